package skillcron.cron.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves skills laid out as {@code <skillsDir>/<id>/}.
 * The display name is the first Markdown heading of {@code SKILL.md}, or the
 * id when there is none.
 */
public class DirectoryTargetResolver implements TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(DirectoryTargetResolver.class);

    static final String SKILL_FILE = "SKILL.md";

    private final Path skillsDir;

    public DirectoryTargetResolver(String skillsDir) {
        this(Paths.get(skillsDir));
    }

    public DirectoryTargetResolver(Path skillsDir) {
        this.skillsDir = skillsDir.toAbsolutePath().normalize();
    }

    @Override
    public Target loadTargetById(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }

        Path dir = skillsDir.resolve(id).normalize();
        // Ids like "../x" must not escape the skills directory
        if (!skillsDir.equals(dir.getParent()) || !Files.isDirectory(dir)) {
            return null;
        }

        return new Target(id, readName(dir, id), dir);
    }

    private String readName(Path dir, String fallback) {
        Path skillFile = dir.resolve(SKILL_FILE);
        if (!Files.isRegularFile(skillFile)) {
            return fallback;
        }
        try (BufferedReader reader = Files.newBufferedReader(skillFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith("#")) {
                    String heading = trimmed.replaceFirst("^#+", "").trim();
                    return heading.isEmpty() ? fallback : heading;
                }
            }
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", skillFile, e.getMessage());
        }
        return fallback;
    }
}
