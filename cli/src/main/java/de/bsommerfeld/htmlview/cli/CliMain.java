package de.bsommerfeld.htmlview.cli;

import com.google.inject.Guice;
import de.bsommerfeld.htmlview.launcher.config.HtmlViewModule;
import picocli.CommandLine;

/**
 * Entry point of the {@code html-view} command-line tool.
 */
public final class CliMain {

    private CliMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        GuiceFactory factory = new GuiceFactory(Guice.createInjector(new HtmlViewModule()));
        return new CommandLine(HtmlViewCommand.class, factory).execute(args);
    }
}
