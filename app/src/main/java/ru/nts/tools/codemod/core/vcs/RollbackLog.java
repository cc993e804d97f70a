/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codemod.core.vcs;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemod.core.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Журнал последней контрольной точки, хранится в {@value #FILE_NAME} в корне рабочего дерева.
 * Кроме самой точки хранит коммит, созданный после модификаций, и сведения о брошенной ветке.
 */
public class RollbackLog {

    private static final Logger log = LoggerFactory.getLogger(RollbackLog.class);

    public static final String FILE_NAME = ".modification_rollback.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path file;

    public RollbackLog(Path root) {
        this.file = root.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    /**
     * Последняя сохраненная контрольная точка.
     */
    public Optional<RollbackPoint> checkpoint() throws IOException {
        ObjectNode data = read();
        if (!data.hasNonNull("commit_hash")) {
            return Optional.empty();
        }
        return Optional.of(mapper.treeToValue(data, RollbackPoint.class));
    }

    /**
     * Записывает новую контрольную точку; прежнее содержимое журнала отбрасывается.
     */
    public void recordCheckpoint(RollbackPoint point) throws IOException {
        write(mapper.valueToTree(point));
    }

    public void recordAppliedCommit(String commitId) throws IOException {
        ObjectNode data = read();
        data.put("applied_commit", commitId);
        write(data);
    }

    public Optional<String> appliedCommit() throws IOException {
        JsonNode value = read().get("applied_commit");
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    public void recordAbandon(String fromBranch, String newBranch) throws IOException {
        ObjectNode data = read();
        data.put("abandoned_from_branch", fromBranch);
        data.put("new_branch", newBranch);
        write(data);
    }

    ObjectNode read() throws IOException {
        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }
        JsonNode node = mapper.readTree(FileUtils.safeReadAllBytes(file));
        if (node == null || !node.isObject()) {
            log.warn("Ignoring unreadable rollback log {}", file);
            return mapper.createObjectNode();
        }
        return (ObjectNode) node;
    }

    private void write(JsonNode data) throws IOException {
        FileUtils.safeWrite(file, mapper.writeValueAsString(data) + "\n", StandardCharsets.UTF_8);
    }
}
