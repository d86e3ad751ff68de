package com.codehealth.app.cli;

import java.nio.file.Path;
import java.util.List;

/**
 * codehealth-merge &lt;path&gt; [--out FILE] [--config FILE]
 * 옵션은 "--out FILE" 과 "--out=FILE" 둘 다 허용.
 */
public record CliArgs(Path input, Path out, Path config, boolean help) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: codehealth-merge <path> [--out FILE] [--config FILE]",
            "  <path>          findings JSON file, or directory scanned recursively for *.json",
            "  --out FILE      write the merged report to FILE (default: stdout)",
            "  --config FILE   audit YAML config (default: ./audit.yml when present)",
            "  -h, --help      show this help");

    public static CliArgs parse(List<String> args) {
        Path input = null, out = null, config = null;
        for (int i = 0; i < args.size(); i++) {
            String a = args.get(i);
            if (a.equals("-h") || a.equals("--help")) {
                return new CliArgs(null, null, null, true);
            } else if (a.equals("--out") || a.equals("--config")) {
                if (i + 1 >= args.size()) throw new IllegalArgumentException("missing value for " + a);
                Path v = Path.of(args.get(++i));
                if (a.equals("--out")) out = v; else config = v;
            } else if (a.startsWith("--out=")) {
                out = Path.of(value(a));
            } else if (a.startsWith("--config=")) {
                config = Path.of(value(a));
            } else if (a.startsWith("-")) {
                throw new IllegalArgumentException("unknown option: " + a);
            } else if (input == null) {
                input = Path.of(a);
            } else {
                throw new IllegalArgumentException("unexpected argument: " + a);
            }
        }
        if (input == null) throw new IllegalArgumentException("missing <path>");
        return new CliArgs(input, out, config, false);
    }

    private static String value(String opt) {
        String v = opt.substring(opt.indexOf('=') + 1);
        if (v.isBlank()) throw new IllegalArgumentException("missing value for " + opt.substring(0, opt.indexOf('=')));
        return v;
    }
}
