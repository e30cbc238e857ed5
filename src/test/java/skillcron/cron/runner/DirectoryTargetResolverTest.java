package skillcron.cron.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryTargetResolverTest {

    @TempDir
    Path skills;

    private DirectoryTargetResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(skills.resolve("daily-report"));
        Files.writeString(skills.resolve("daily-report").resolve("SKILL.md"),
                "\n## Daily Report\n\nSummarise yesterday.\n");
        Files.createDirectories(skills.resolve("bare"));
        Files.writeString(skills.resolve("notes.txt"), "not a skill");
        resolver = new DirectoryTargetResolver(skills);
    }

    @Test
    void resolvesSkillWithHeading() {
        Target target = resolver.loadTargetById("daily-report");
        assertNotNull(target);
        assertEquals("daily-report", target.id());
        assertEquals("Daily Report", target.name());
        assertEquals(skills.toAbsolutePath().normalize().resolve("daily-report"), target.directory());
    }

    @Test
    void fallsBackToIdWithoutSkillFile() {
        assertEquals("bare", resolver.loadTargetById("bare").name());
    }

    @Test
    void unknownOrEscapingIdsResolveToNull() {
        assertNull(resolver.loadTargetById("missing"));
        assertNull(resolver.loadTargetById("notes.txt"));
        assertNull(resolver.loadTargetById("../daily-report"));
        assertNull(resolver.loadTargetById("daily-report/.."));
        assertNull(resolver.loadTargetById(""));
        assertNull(resolver.loadTargetById(null));
    }
}
