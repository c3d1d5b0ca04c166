package org.learningjava.biasscore.domain.service;

import org.learningjava.biasscore.domain.model.ModelPerspective;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.Perspective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Resolves a provider model name to its ideological perspective using the ordered
 * model table from the composite config. The first matching entry wins, exact matches
 * before prefix matches.
 */
@Component
public class PerspectiveMapper {

    private static final Logger log = LoggerFactory.getLogger(PerspectiveMapper.class);

    /**
     * @return the lower-cased perspective label, or {@code ""} when the model is unknown
     */
    public String map(String modelName, List<ModelPerspective> table) {
        if (table == null || table.isEmpty()) {
            log.warn("Model table is empty; cannot map model '{}'", modelName);
            return "";
        }

        if (modelName == null || modelName.isEmpty()) {
            for (ModelPerspective m : table) {
                if (m.modelName().isEmpty()) return lower(m.perspective());
            }
            return "";
        }

        String name = normalize(modelName);

        for (ModelPerspective m : table) {
            if (name.equals(normalize(m.modelName()))) return lower(m.perspective());
        }

        for (ModelPerspective m : table) {
            String entry = normalize(m.modelName());
            if (!entry.isEmpty() && name.startsWith(entry)) return lower(m.perspective());
        }

        // legacy rows were stored under the perspective label itself
        if ("neutral".equals(name)) return Perspective.CENTER.label();
        var legacy = Perspective.fromLabel(name);
        if (legacy.isPresent()) return legacy.get().label();

        if (ModelScore.ENSEMBLE_MODEL.equals(name)) return Perspective.CENTER.label();

        log.warn("Model '{}' not found in composite score configuration", modelName);
        return "";
    }

    /** Trim, lower-case and drop a trailing {@code :version} tag. */
    static String normalize(String modelName) {
        if (modelName == null) return "";
        String n = modelName.trim().toLowerCase(Locale.ROOT);
        int colon = n.indexOf(':');
        return colon >= 0 ? n.substring(0, colon) : n;
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
