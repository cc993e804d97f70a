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
package ru.nts.tools.codemod.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

/**
 * Проверка и нормализация путей, переданных в операциях пакета изменений.
 * Все пути разрешаются относительно рабочего корня (корня git-репозитория)
 * и не могут выходить за его пределы. Служебная папка .git защищена от изменений.
 */
public final class PathSanitizer {

    /**
     * Имена, изменение которых операциями пакета запрещено.
     */
    private static final Set<String> PROTECTED_NAMES = Set.of(".git");

    private final Path root;

    public PathSanitizer(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Разрешает путь относительно корня.
     *
     * @param requestedPath путь из операции (относительный или абсолютный, может содержать '..')
     * @return абсолютный нормализованный путь внутри корня
     * @throws CodemodException PATH_OUTSIDE_ROOT, если путь ведет за пределы корня или в защищенную папку
     */
    public Path sanitize(String requestedPath) {
        // Предварительная нормализация разделителей для Windows
        String normalizedRequest = requestedPath.strip().replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);

        Path target = requested.isAbsolute()
                ? requested.toAbsolutePath().normalize()
                : root.resolve(normalizedRequest).toAbsolutePath().normalize();

        if (!target.startsWith(root) || isProtected(root.relativize(target))) {
            throw new CodemodException(CodemodErrorCode.PATH_OUTSIDE_ROOT,
                    Map.of("path", requestedPath, "root", root));
        }
        return target;
    }

    /**
     * Путь относительно корня в форме, пригодной для git (разделитель '/').
     */
    public String relativize(Path absolute) {
        String relative = root.relativize(absolute.toAbsolutePath().normalize()).toString();
        return relative.replace('\\', '/');
    }

    public Path getRoot() {
        return root;
    }

    private static boolean isProtected(Path relative) {
        for (Path part : relative) {
            if (PROTECTED_NAMES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
