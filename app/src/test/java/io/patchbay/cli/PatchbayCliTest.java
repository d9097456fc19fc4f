package io.patchbay.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.patchbay.config.PatchbaySettings;
import io.patchbay.testutil.FakeCloudServer;
import io.patchbay.testutil.TestRepos;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PatchbayCliTest {

    @TempDir
    Path tempDir;

    private FakeCloudServer server;
    private final List<URI> connectedTo = new ArrayList<>();
    private final List<@Nullable String> tokens = new ArrayList<>();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path settingsFile;

    @BeforeEach
    void setUp() {
        server = new FakeCloudServer();
        settingsFile = tempDir.resolve("settings.properties");
    }

    private int run(String... args) {
        var cli = new PatchbayCli((base, token, settings) -> {
            connectedTo.add(base);
            tokens.add(token);
            return server;
        });
        var commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        var all = new ArrayList<String>();
        all.add("--settings");
        all.add(settingsFile.toString());
        all.addAll(List.of(args));
        return commandLine.execute(all.toArray(new String[0]));
    }

    @Test
    void showPrintsTheDraft() {
        var draftId = server.addDraft();
        var patchId = server.addStoredPatch(draftId, "diff");

        assertEquals(0, run("show", draftId));

        var printed = out.toString();
        assertTrue(printed.contains("Draft:      " + draftId), printed);
        assertTrue(printed.contains("Title:      Fix things"), printed);
        assertTrue(printed.contains("Visibility: public"), printed);
        assertTrue(printed.contains(patchId), printed);
    }

    @Test
    void showReportsAMissingDraft() {
        assertEquals(1, run("show", "nope"));
        assertTrue(err.toString().contains("Cloud patch 'nope' was not found"), err.toString());
    }

    @Test
    void contentsPrintsTheStoredDiff() {
        var patchId = server.addStoredPatch(server.addDraft(), "the diff\n");

        assertEquals(0, run("contents", patchId));
        assertEquals("the diff\n", out.toString());
    }

    @Test
    void contentsOfAnUnknownPatchFails() {
        assertEquals(1, run("contents", "missing"));
        assertTrue(err.toString().startsWith("ERROR: "), err.toString());
    }

    @Test
    void patchesExitsNonZeroWhenADownloadFails() {
        var draftId = server.addDraft();
        var ok = server.addStoredPatch(draftId, "first");
        var broken = server.addStoredPatch(draftId, null);

        assertEquals(1, run("patches", draftId, "--contents"));

        var printed = out.toString();
        assertTrue(printed.contains(ok), printed);
        assertTrue(printed.contains("first"), printed);
        assertTrue(printed.contains(broken + "  FAILED"), printed);
    }

    @Test
    void publishUploadsTheDiff() throws Exception {
        var repoDir = tempDir.resolve("repo");
        try (var git = TestRepos.init(repoDir)) {
            TestRepos.addRemote(git, "origin", "https://github.com/acme/widgets.git");
        }
        var diffFile = tempDir.resolve("change.diff");
        Files.writeString(diffFile, TestRepos.HELLO_DIFF);

        assertEquals(0, run("publish", "--repo", repoDir.toString(), diffFile.toString()), err.toString());

        assertTrue(out.toString().contains("Draft:      draft-1"), out.toString());
        assertEquals(TestRepos.HELLO_DIFF, server.blob("patch-3"));
    }

    @Test
    void publishWithoutAKnownProviderFails() throws Exception {
        var repoDir = tempDir.resolve("repo");
        TestRepos.init(repoDir).close();
        var diffFile = tempDir.resolve("change.diff");
        Files.writeString(diffFile, TestRepos.HELLO_DIFF);

        assertEquals(1, run("publish", "--repo", repoDir.toString(), diffFile.toString()));
        assertTrue(err.toString().contains("No Git provider found"), err.toString());
    }

    @Test
    void commandLineOverridesAreNotPersisted() throws Exception {
        new PatchbaySettings(settingsFile).set(PatchbaySettings.API_TOKEN, "stored");

        run("--api-url", "http://localhost:9000/api", "--token", "override", "show", "nope");
        run("show", "nope");

        assertEquals(List.of(URI.create("http://localhost:9000/api/"), URI.create(PatchbaySettings.DEFAULT_API_BASE_URL)),
                connectedTo);
        assertEquals(List.of("override", "stored"), tokens);
        assertEquals("stored", new PatchbaySettings(settingsFile).getApiToken().orElseThrow());
    }
}
