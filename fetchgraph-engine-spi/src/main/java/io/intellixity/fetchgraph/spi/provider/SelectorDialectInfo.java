package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An alternative selector syntax a provider accepts inside a {@code $dsl} envelope. */
public record SelectorDialectInfo(String id,
                                  String description,
                                  @JsonProperty("payload_format") String payloadFormat,
                                  @JsonProperty("envelope_example") String envelopeExample,
                                  String notes) {
}
