package com.codehealth.app.cli;

import com.codehealth.core.loader.FindingSourceException;
import com.codehealth.core.loader.InvalidFindingException;
import com.codehealth.core.loader.NoSourcesException;
import com.codehealth.core.model.AuditConfig;
import com.codehealth.core.service.MergeOutcome;
import com.codehealth.core.service.MergeService;
import com.codehealth.core.service.export.JsonReportExporter;
import com.codehealth.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * CLI 진입 로직. System.exit 호출 없이 종료 코드를 돌려준다(테스트 용이).
 * 종료 코드: 0 성공 / 1 입력 JSON 없음 / 2 사용법·경로·파싱·설정 오류
 */
public final class MergeCommand {

    private static final Logger LOG = LoggerFactory.getLogger(MergeCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_INPUT = 1;
    public static final int EXIT_ERROR = 2;

    public int run(String[] argv, PrintStream out, PrintStream err) {
        CliArgs args;
        try {
            args = CliArgs.parse(Arrays.asList(argv));
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_ERROR;
        }
        if (args.help()) {
            out.println(CliArgs.USAGE);
            return EXIT_OK;
        }

        AuditConfig cfg;
        try {
            cfg = (args.config() != null) ? YamlConfigLoader.load(args.config()) : YamlConfigLoader.loadDefault();
        } catch (IOException | RuntimeException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            MergeOutcome outcome = new MergeService(cfg).run(args.input());
            JsonReportExporter exporter = new JsonReportExporter(cfg.getOutput().isPretty());
            if (args.out() != null) {
                Path written = exporter.export(outcome.report(), args.out());
                LOG.info("Report written: {} ({} finding(s))", written.toAbsolutePath(), outcome.report().totalFindings());
            } else {
                exporter.write(outcome.report(), out);
            }
            return EXIT_OK;
        } catch (NoSourcesException e) {
            err.println("No JSON files found.");
            return EXIT_NO_INPUT;
        } catch (FindingSourceException e) {
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InvalidFindingException e) {
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            LOG.error("Report export failed", e);
            err.println("error: failed to write report: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
