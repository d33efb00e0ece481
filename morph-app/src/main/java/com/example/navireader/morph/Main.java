package com.example.navireader.morph;

import com.example.navireader.morph.cli.NaviConsoleApplication;

/**
 * Entry point for the morphology module.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        NaviConsoleApplication.main(args);
    }
}
