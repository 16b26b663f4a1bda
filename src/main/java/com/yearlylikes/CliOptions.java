package com.yearlylikes;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line. Usage errors are reported as {@link IllegalArgumentException}.
 */
final class CliOptions {

    enum Command { SORT, REMOVE_ARTISTS }

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: yearly-likes [sort|remove-artists] [options]",
            "",
            "Commands:",
            "  sort                  Sort liked songs into one playlist per year (default)",
            "  remove-artists        Remove liked songs by blocked artists from the library",
            "",
            "Options:",
            "  --blocklist <file>    JSON array or text file (one name per line) of artists to remove",
            "  --artist <name>       Artist to remove; may be repeated",
            "  --fixed-stride        Advance the library offset by the full page size after removals",
            "  --report <file>       Write the run report as JSON",
            "  --logout              Forget stored Spotify tokens and exit",
            "  -h, --help            Show this help");

    Command command = Command.SORT;
    Path blocklistFile;
    final List<String> artists = new ArrayList<>();
    boolean fixedStride;
    Path reportFile;
    boolean logout;
    boolean help;

    static CliOptions parse(String[] args) {
        CliOptions options = new CliOptions();
        boolean commandSeen = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "sort" -> options.command = requireFirst(commandSeen, Command.SORT, arg);
                case "remove-artists" -> options.command = requireFirst(commandSeen, Command.REMOVE_ARTISTS, arg);
                case "--blocklist" -> options.blocklistFile = Path.of(valueAfter(args, ++i, arg));
                case "--artist" -> options.artists.add(valueAfter(args, ++i, arg));
                case "--fixed-stride" -> options.fixedStride = true;
                case "--report" -> options.reportFile = Path.of(valueAfter(args, ++i, arg));
                case "--logout" -> options.logout = true;
                case "-h", "--help" -> options.help = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
            if (arg.equals("sort") || arg.equals("remove-artists")) {
                commandSeen = true;
            }
        }
        if (options.command == Command.SORT
                && (options.blocklistFile != null || !options.artists.isEmpty() || options.fixedStride)) {
            throw new IllegalArgumentException("--blocklist, --artist and --fixed-stride only apply to remove-artists");
        }
        return options;
    }

    private static Command requireFirst(boolean commandSeen, Command command, String arg) {
        if (commandSeen) {
            throw new IllegalArgumentException("Only one command allowed, got another: " + arg);
        }
        return command;
    }

    private static String valueAfter(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
