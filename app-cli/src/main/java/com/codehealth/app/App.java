package com.codehealth.app;

import com.codehealth.app.cli.MergeCommand;
import com.codehealth.app.logging.LogSetup;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    private App() {}

    public static void main(String[] args) {
        LogSetup.init();

        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "==== Uncaught: " + t.getName() + " ====", e));

        int code = new MergeCommand().run(args, System.out, System.err);
        System.exit(code);
    }
}
