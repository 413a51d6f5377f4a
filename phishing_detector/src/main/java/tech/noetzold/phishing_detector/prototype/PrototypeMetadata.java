package tech.noetzold.phishing_detector.prototype;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import tech.noetzold.phishing_detector.model.Label;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrototypeMetadata(
        Label label,
        String url,
        Integer size,
        Integer cluster,
        String source
) {}
