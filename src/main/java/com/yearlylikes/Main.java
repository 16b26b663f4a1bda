package com.yearlylikes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.yearlylikes.auth.AuthenticationException;
import com.yearlylikes.auth.SpotifyAuthenticator;
import com.yearlylikes.auth.TokenStore;
import com.yearlylikes.filter.ArtistTrackRemover;
import com.yearlylikes.filter.Blocklist;
import com.yearlylikes.filter.BlocklistLoader;
import com.yearlylikes.filter.PagingMode;
import com.yearlylikes.filter.RemovalReport;
import com.yearlylikes.image.WaveCoverImageGenerator;
import com.yearlylikes.processor.ProcessorException;
import com.yearlylikes.processor.RunContext;
import com.yearlylikes.sorter.PlaylistSortException;
import com.yearlylikes.sorter.PlaylistSorter;
import com.yearlylikes.sorter.SortReport;
import com.yearlylikes.spotify.SpotifyClientException;
import com.yearlylikes.spotify.SpotifyUser;
import com.yearlylikes.spotify.SpotifyWebApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.SpotifyApi;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PROCESSOR_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_AUTH_FAILED = 3;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            System.out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        Config config = Config.load();
        config.printStatus();
        TokenStore tokenStore = new TokenStore(config.getTokenFile());
        if (options.logout) {
            if (!tokenStore.clear()) {
                System.out.println("No stored tokens at " + tokenStore.getFile());
            }
            return EXIT_OK;
        }
        if (!config.hasSpotifyCredentials()) {
            log.error("SPOTIFY_CLIENT_ID and SPOTIFY_CLIENT_SECRET must be set.");
            return EXIT_USAGE;
        }

        Blocklist blocklist = null;
        if (options.command == CliOptions.Command.REMOVE_ARTISTS) {
            try {
                blocklist = buildBlocklist(config, options);
            } catch (IOException e) {
                log.error("Could not read blocklist: {}", e.getMessage());
                return EXIT_USAGE;
            }
            if (blocklist.isEmpty()) {
                log.error("No artists to remove. Use --artist, --blocklist or BLOCKED_ARTISTS.");
                return EXIT_USAGE;
            }
        }

        SpotifyApi api;
        try {
            api = authenticate(config, tokenStore);
        } catch (AuthenticationException e) {
            log.error("Authentication failed: {}", e.getMessage());
            return EXIT_AUTH_FAILED;
        }

        SpotifyWebApiGateway gateway = new SpotifyWebApiGateway(api);
        try {
            SpotifyUser user = gateway.currentUser();
            System.out.println("Logged in as: " + (user.displayName() != null ? user.displayName() : user.id()));
        } catch (SpotifyClientException e) {
            log.error("Couldn't get current user: {}", e.getMessage());
            return EXIT_AUTH_FAILED;
        }

        RunContext context = RunContext.withTimeout(config.getRunTimeout());
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            context.cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "yearly-likes-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            Object report;
            if (options.command == CliOptions.Command.REMOVE_ARTISTS) {
                PagingMode mode = options.fixedStride ? PagingMode.FIXED_STRIDE : PagingMode.COMPENSATED;
                RemovalReport removal = new ArtistTrackRemover(gateway, blocklist, mode).run(context);
                System.out.printf("Removed %d track(s) by blocked artists (%d page(s) failed).%n",
                        removal.tracksRemoved(), removal.failedPages());
                report = removal;
            } else {
                PlaylistSorter sorter = new PlaylistSorter(gateway, gateway, gateway, new WaveCoverImageGenerator());
                SortReport sort = sorter.run(context);
                System.out.printf("Sorted %d liked song(s) into %d yearly playlist(s).%n",
                        sort.likedTracks() - sort.skippedTracks(), sort.years().size());
                report = sort;
            }
            writeReport(options.reportFile, report);
            return EXIT_OK;
        } catch (PlaylistSortException e) {
            log.error("Processor run failed: {}", e.getMessage(), e.getCause());
            if (e.getYear() != null) {
                log.error("Years from {} on were left unchanged; it is safe to run again.", e.getYear());
            }
            return EXIT_PROCESSOR_FAILED;
        } catch (ProcessorException e) {
            log.error("Processor run failed: {}", e.getMessage(), e.getCause());
            return EXIT_PROCESSOR_FAILED;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    private static SpotifyApi authenticate(Config config, TokenStore tokenStore) throws AuthenticationException {
        SpotifyAuthenticator authenticator = new SpotifyAuthenticator(
                config.getSpotifyClientId(),
                config.getSpotifyClientSecret(),
                config.getRedirectUri(),
                tokenStore,
                config.getRequestTimeout());

        Optional<SpotifyApi> resumed = authenticator.resumeFromStoredToken();
        if (resumed.isPresent()) {
            return resumed.get();
        }
        System.out.println("Please log in to Spotify by visiting this URL in your browser:");
        System.out.println(authenticator.authorizationUrl());
        return authenticator.authorize(config.getAuthTimeout());
    }

    static Blocklist buildBlocklist(Config config, CliOptions options) throws IOException {
        List<String> names = new ArrayList<>(config.getBlockedArtists());
        if (options.blocklistFile != null) {
            names.addAll(new BlocklistLoader(MAPPER).load(options.blocklistFile));
        }
        names.addAll(options.artists);
        return Blocklist.of(names);
    }

    private static void writeReport(Path file, Object report) {
        if (file == null) {
            return;
        }
        try {
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            MAPPER.writeValue(file.toFile(), report);
            log.info("Report written to {}", file);
        } catch (IOException e) {
            log.warn("Could not write report to {}: {}", file, e.getMessage());
        }
    }
}
