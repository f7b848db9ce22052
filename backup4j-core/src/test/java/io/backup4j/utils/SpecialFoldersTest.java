package io.backup4j.utils;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SpecialFoldersTest {

    private final Path home = Path.of("/home/alice");
    private final SpecialFolders folders = new SpecialFolders(home, Map.of("PROJECTS", "/srv/projects"));

    @Test
    void expandShouldResolveKnownFoldersAndEnvironment() {
        assertEquals(home.resolve("Documents") + "/taxes", folders.expand("%MY_DOCUMENTS%/taxes"));
        assertEquals("/srv/projects/a", folders.expand("%PROJECTS%/a"));
    }

    @Test
    void expandShouldKeepUnknownPlaceholders() {
        assertEquals("%NOPE%/x", folders.expand("%NOPE%/x"));
    }

    @Test
    void expandRegexShouldQuoteSubstitutedPath() {
        String expanded = folders.expandRegex("[%PROJECTS%/.*\\.tmp]");
        assertEquals("[" + Pattern.quote("/srv/projects") + "/.*\\.tmp]", expanded);
    }
}
