package org.learningjava.biasscore.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the model-to-perspective table. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelPerspective(
        @JsonProperty("modelName") String modelName,
        @JsonProperty("perspective") String perspective,
        @JsonProperty("weight") double weight,
        @JsonProperty("url") String url
) {
    public ModelPerspective {
        modelName = modelName == null ? "" : modelName;
        perspective = perspective == null ? "" : perspective;
        url = url == null ? "" : url;
    }

    public ModelPerspective(String modelName, String perspective) {
        this(modelName, perspective, 0.0, "");
    }
}
