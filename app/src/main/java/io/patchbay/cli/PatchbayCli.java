package io.patchbay.cli;

import io.patchbay.cloud.CloudPatchClient;
import io.patchbay.cloud.OkHttpServerConnection;
import io.patchbay.cloud.ServerConnection;
import io.patchbay.config.PatchbaySettings;
import io.patchbay.git.GitRepo;
import io.patchbay.git.GitRepoException;
import io.patchbay.patch.CloudPatch;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

@CommandLine.Command(
        name = "patchbay",
        mixinStandardHelpOptions = true,
        description = "Publish local diffs as cloud patches and read them back.",
        subcommands = {
            PatchbayCli.Publish.class,
            PatchbayCli.Show.class,
            PatchbayCli.Patches.class,
            PatchbayCli.Contents.class
        })
public final class PatchbayCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PatchbayCli.class);

    @CommandLine.Spec
    @SuppressWarnings("NullAway.Init")
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "--settings",
            description = "Settings file to use instead of ~/.config/patchbay/patchbay.properties.")
    @Nullable
    private Path settingsFile;

    @CommandLine.Option(names = "--api-url", description = "Base URL of the cloud patch API.")
    @Nullable
    private String apiUrl;

    @CommandLine.Option(names = "--token", description = "API token; defaults to the configured one.")
    @Nullable
    private String token;

    private final ConnectionFactory connectionFactory;

    public PatchbayCli() {
        this((base, bearer, settings) -> new OkHttpServerConnection(
                base, bearer, settings.getConnectTimeout(), settings.getReadTimeout()));
    }

    @VisibleForTesting
    PatchbayCli(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @FunctionalInterface
    interface ConnectionFactory {
        ServerConnection create(URI baseApiUri, @Nullable String token, PatchbaySettings settings);
    }

    public static void main(String[] args) {
        logger.info("Starting Patchbay CLI...");
        int exitCode = new CommandLine(new PatchbayCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** Options given on the command line win over the settings file and are never written back to it. */
    ServerConnection connect() {
        var settings = settingsFile == null ? PatchbaySettings.forUser() : new PatchbaySettings(settingsFile);
        var base = settings.getApiBaseUri();
        if (apiUrl != null) {
            base = URI.create(apiUrl.endsWith("/") ? apiUrl : apiUrl + "/");
        }
        var bearer = token != null ? token : settings.getApiToken().orElse(null);
        return connectionFactory.create(base, bearer, settings);
    }

    /** Runs {@code action} against a client backed by a fresh executor, translating failures into exit code 1. */
    int withClient(CommandLine.Model.CommandSpec sub, ClientAction action) {
        var err = sub.commandLine().getErr();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            var client = new CloudPatchClient(connect(), executor);
            return action.run(client, sub.commandLine().getOut());
        } catch (ExecutionException e) {
            var cause = CloudPatchClient.unwrap(e);
            logger.error("Command {} failed", sub.name(), cause);
            err.println("ERROR: " + cause.getMessage());
            return 1;
        } catch (IOException | GitRepoException | IllegalArgumentException e) {
            logger.error("Command {} failed", sub.name(), e);
            err.println("ERROR: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("ERROR: interrupted");
            return 1;
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    interface ClientAction {
        int run(CloudPatchClient client, PrintWriter out)
                throws ExecutionException, InterruptedException, IOException, GitRepoException;
    }

    private static <T> T await(CompletableFuture<T> future) throws ExecutionException, InterruptedException {
        return future.get();
    }

    static void printPatch(PrintWriter out, CloudPatch patch) {
        out.println("Draft:      " + patch.id());
        if (patch.title() != null) {
            out.println("Title:      " + patch.title());
        }
        if (patch.linkUrl() != null) {
            out.println("Link:       " + patch.linkUrl());
        }
        out.println("Created:    " + patch.createdAt() + " by " + patch.createdBy());
        out.println("Visibility: " + (patch.isPublic() ? "public" : "private"));
        for (var changeset : patch.changesets()) {
            out.println("Changeset " + changeset.id() + " (" + changeset.patches().size() + " patch(es))");
            for (var remote : changeset.patches()) {
                out.println("  " + remote.id() + "  base " + remote.baseCommitSha() + " on " + remote.baseBranchName());
            }
        }
    }

    @CommandLine.Command(name = "publish", description = "Publish a diff as a new cloud patch.")
    static final class Publish implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        PatchbayCli parent;

        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--repo", description = "Repository the diff belongs to.", defaultValue = ".")
        Path repoPath = Path.of(".");

        @CommandLine.Option(names = "--base", description = "Commit the diff is based on.", defaultValue = "HEAD")
        String base = "HEAD";

        @CommandLine.Parameters(index = "0", description = "Diff file, or '-' for standard input.")
        String diff = "-";

        @Override
        @Blocking
        public Integer call() {
            return parent.withClient(spec, (client, out) -> {
                var contents = readDiff(diff);
                try (var repo = new GitRepo(repoPath)) {
                    var baseSha = repo.resolveCommit(base);
                    var created = await(client.create(repo, baseSha, contents));
                    printPatch(out, created);
                    return 0;
                }
            });
        }

        private static String readDiff(String source) throws IOException {
            if ("-".equals(source)) {
                try (InputStream in = System.in) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        }
    }

    @CommandLine.Command(name = "show", description = "Show a cloud patch and its changesets.")
    static final class Show implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        PatchbayCli parent;

        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Draft id.")
        String id = "";

        @Override
        @Blocking
        public Integer call() {
            return parent.withClient(spec, (client, out) -> {
                var found = await(client.get(id));
                if (found.isEmpty()) {
                    spec.commandLine().getErr().println("Cloud patch '" + id + "' was not found");
                    return 1;
                }
                printPatch(out, found.get());
                return 0;
            });
        }
    }

    @CommandLine.Command(name = "patches", description = "List the patches of a draft.")
    static final class Patches implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        PatchbayCli parent;

        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Draft id.")
        String id = "";

        @CommandLine.Option(names = "--contents", description = "Download and print each patch's diff.")
        boolean includeContents;

        @Override
        @Blocking
        public Integer call() {
            return parent.withClient(spec, (client, out) -> {
                var results = await(client.getPatches(id, includeContents));
                int failures = 0;
                for (var result : results) {
                    var data = result.data();
                    if (data == null) {
                        failures++;
                        out.println(result.id() + "  FAILED: " + result.error());
                        continue;
                    }
                    out.println(data.id() + "  " + data.gitRepositoryName() + "@" + data.gitBranchName());
                    if (includeContents) {
                        out.println(data.contents());
                    }
                }
                return failures == 0 ? 0 : 1;
            });
        }
    }

    @CommandLine.Command(name = "contents", description = "Print the diff stored for a patch.")
    static final class Contents implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        PatchbayCli parent;

        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Patch id.")
        String id = "";

        @Override
        @Blocking
        public Integer call() {
            return parent.withClient(spec, (client, out) -> {
                out.print(await(client.getPatchContents(id)));
                out.flush();
                return 0;
            });
        }
    }
}
