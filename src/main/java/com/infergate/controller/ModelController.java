package com.infergate.controller;

import com.infergate.config.InfergateProperties;
import com.infergate.model.ModelInfo;
import com.infergate.model.ModelList;
import com.infergate.service.ServerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Model discovery for aggregators. Describes the one configured model.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class ModelController {

    private final InfergateProperties properties;
    private final ServerState serverState;

    public ModelController(InfergateProperties properties, ServerState serverState) {
        this.properties = properties;
        this.serverState = serverState;
    }

    @GetMapping("/models")
    public Mono<ModelList> listModels() {
        InfergateProperties.ModelConfig model = properties.getModel();
        InfergateProperties.PricingConfig pricing = properties.getPricing();

        ModelInfo info = ModelInfo.builder()
                .id(model.getId())
                .object("model")
                .created(serverState.getStartTime().getEpochSecond())
                .ownedBy(model.getOrganizationId())
                .name(model.getDisplayName())
                .contextLength(model.getContextLength())
                .pricing(new ModelInfo.Pricing(pricing.getPrompt(), pricing.getCompletion()))
                .quantization(model.getQuantization())
                .supportedFeatures(model.getSupportedFeatures())
                .build();

        log.debug("Listing model {}", model.getId());
        return Mono.just(ModelList.of(info));
    }
}
