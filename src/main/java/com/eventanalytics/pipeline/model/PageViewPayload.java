package com.eventanalytics.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional payload of a page view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageViewPayload {

    @NotBlank
    @Size(max = 2048)
    @Pattern(regexp = "^(?i)https?://\\S+$", message = "must be a valid HTTP or HTTPS URL")
    @JsonProperty("page_url")
    private String pageUrl;
}
