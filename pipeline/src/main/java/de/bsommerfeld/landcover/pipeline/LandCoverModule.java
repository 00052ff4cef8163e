package de.bsommerfeld.landcover.pipeline;

import com.google.inject.AbstractModule;
import de.bsommerfeld.landcover.backend.InMemoryRasterBackend;
import de.bsommerfeld.landcover.backend.RasterBackend;
import de.bsommerfeld.landcover.core.config.AggregationConfig;
import de.bsommerfeld.landcover.core.config.AssessmentConfig;
import de.bsommerfeld.landcover.core.config.BackendConfig;
import de.bsommerfeld.landcover.core.config.ConfigurationLoader;
import de.bsommerfeld.landcover.core.config.GlobalConfig;
import de.bsommerfeld.landcover.core.domain.Legend;
import de.bsommerfeld.landcover.core.event.ApplicationEventBus;
import de.bsommerfeld.landcover.core.util.AppDirectories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for the aggregation and assessment components.
 *
 * <p>
 * {@link RasterBackend} is bound to {@link InMemoryRasterBackend}. Deployments
 * against a distributed engine replace that binding with
 * {@code Modules.override(new LandCoverModule()).with(...)}.
 */
public class LandCoverModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(LandCoverModule.class);

    private final Path configPath;
    private final GlobalConfig preloaded;

    /** Loads {@code config.json} from the platform application directory. */
    public LandCoverModule() {
        this(AppDirectories.defaultConfigFile());
    }

    public LandCoverModule(Path configPath) {
        this.configPath = configPath;
        this.preloaded = null;
    }

    public LandCoverModule(GlobalConfig config) {
        this.configPath = null;
        this.preloaded = config;
    }

    @Override
    protected void configure() {
        GlobalConfig config = preloaded;
        if (config == null) {
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            config = ConfigurationLoader.from(configPath).load();
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(AggregationConfig.class).toInstance(config.getAggregation());
        bind(AssessmentConfig.class).toInstance(config.getAssessment());
        bind(BackendConfig.class).toInstance(config.getBackend());

        Legend legend = config.getLegend();
        LOG.info("Legend initialized with {} classes: {}", legend.size(), legend.names());
        bind(Legend.class).toInstance(legend);

        bind(RasterBackend.class).to(InMemoryRasterBackend.class);
        bind(ApplicationEventBus.class).asEagerSingleton();
    }
}
