package io.intellixity.fetchgraph.examples.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.fetchgraph.examples.service.ProviderService;
import io.intellixity.fetchgraph.spi.provider.ProviderInfo;
import io.intellixity.fetchgraph.spi.result.ProviderResult;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/provider")
public final class ProviderController {
  private final ProviderService provider;

  public ProviderController(ProviderService provider) {
    this.provider = provider;
  }

  @GetMapping("/describe")
  public ProviderInfo describe() {
    return provider.describe();
  }

  @PostMapping(value = "/fetch", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ProviderResult fetch(@RequestBody JsonNode selectors) {
    return provider.fetch(selectors);
  }

  /** Body is the raw sketch, relaxed text or JSON. */
  @PostMapping("/sketch")
  public ProviderService.SketchOutcome sketch(@RequestBody String sketch) {
    return provider.sketch(sketch);
  }

  @GetMapping(value = "/summary", produces = MediaType.TEXT_PLAIN_VALUE)
  public String summary(@RequestParam("sketch") String sketch) {
    return provider.summary(sketch);
  }
}
