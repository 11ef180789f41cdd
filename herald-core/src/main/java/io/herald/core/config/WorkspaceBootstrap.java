package io.herald.core.config;

import io.herald.core.content.ContentSection;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lays out a fresh workspace: the content directory read by the file content source, a per-user directory,
 * and empty section files so the first run has something to render. Existing files are left alone.
 */
public final class WorkspaceBootstrap {

    private WorkspaceBootstrap() {
    }

    public static void ensureWorkspace(Path workspace, Path contentDir) throws IOException {
        Files.createDirectories(workspace);
        Files.createDirectories(contentDir.resolve("users"));

        for (ContentSection section : ContentSection.values()) {
            if (section == ContentSection.USER || section == ContentSection.HEALTH) {
                continue;
            }
            Path file = contentDir.resolve(section.key() + ".json");
            if (!Files.exists(file)) {
                Files.writeString(file, section.listValued() ? "[]\n" : "{}\n", StandardCharsets.UTF_8);
            }
        }

        Path readme = contentDir.resolve("README.md");
        if (!Files.exists(readme)) {
            Files.writeString(readme, """
                # Newsletter content

                Each section is read from `<section>.json` in this directory. Personalized sections
                (`user`, `recommendations`) are read from `users/<userId>/<section>.json` first.
                """, StandardCharsets.UTF_8);
        }
    }
}
