package de.bsommerfeld.htmlview.launcher.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.htmlview.launcher.locate.AppLocator;
import de.bsommerfeld.htmlview.launcher.locate.DefaultAppLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the launcher.
 *
 * <p>
 * {@link de.bsommerfeld.htmlview.launcher.ViewerLauncher} and
 * {@link de.bsommerfeld.htmlview.launcher.event.ViewerEventBus} are bound
 * just-in-time through their {@code @Inject} constructors.
 */
public class HtmlViewModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlViewModule.class);

    private final ViewerSettings settings;

    public HtmlViewModule() {
        this(ViewerSettings.fromEnvironment());
    }

    public HtmlViewModule(ViewerSettings settings) {
        this.settings = settings;
    }

    @Override
    protected void configure() {
        LOG.debug("Viewer settings: {}", settings);
        bind(ViewerSettings.class).toInstance(settings);
        bind(AppLocator.class).to(DefaultAppLocator.class);
    }
}
