package de.bsommerfeld.htmlview.cli;

import com.google.inject.ConfigurationException;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Lets picocli obtain command objects from Guice so that they can receive
 * injected collaborators. Types Guice cannot construct fall back to picocli's
 * default factory.
 */
final class GuiceFactory implements CommandLine.IFactory {

    private static final Logger LOG = LoggerFactory.getLogger(GuiceFactory.class);

    private final Injector injector;

    GuiceFactory(Injector injector) {
        this.injector = injector;
    }

    @Override
    public <K> K create(Class<K> type) throws Exception {
        try {
            return injector.getInstance(type);
        } catch (ConfigurationException e) {
            LOG.trace("Guice cannot create {}, using picocli default factory", type.getName());
            return CommandLine.defaultFactory().create(type);
        }
    }
}
