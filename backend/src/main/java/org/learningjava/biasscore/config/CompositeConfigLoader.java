package org.learningjava.biasscore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/** Reads and validates the composite score JSON once at start-up. */
public class CompositeConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CompositeConfigLoader.class);

    private final ResourceLoader resources;
    private final ObjectMapper om;

    public CompositeConfigLoader(ResourceLoader resources) {
        this.resources = resources;
        this.om = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CompositeConfig load(String location) {
        Resource r = resources.getResource(location);
        if (!r.exists()) {
            throw new IllegalStateException("Composite score config not found: " + location);
        }
        try (InputStream in = r.getInputStream()) {
            CompositeConfig cfg = om.readValue(in, CompositeConfig.class).validate();
            log.info("Loaded composite score config from {}: formula={}, models={}",
                    location, cfg.formula(), cfg.models().size());
            return cfg;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot parse composite score config " + location, e);
        }
    }
}
