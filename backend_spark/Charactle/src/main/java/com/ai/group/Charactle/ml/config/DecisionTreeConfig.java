package com.ai.group.Charactle.ml.config;

import com.ai.group.Charactle.ml.persistence.ModelStateCodec;
import com.ai.group.Charactle.ml.persistence.ModelStore;
import com.ai.group.Charactle.ml.pipeline.CharacterDecisionTree;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecisionTreeConfig {

    @Bean
    public CharacterDecisionTree characterDecisionTree(DecisionTreeProperties props) {
        return new CharacterDecisionTree(props.toHyperparameters(), props.getMaxTextFeatures());
    }

    @Bean
    public ModelStateCodec modelStateCodec(ObjectMapper objectMapper) {
        return new ModelStateCodec(objectMapper);
    }

    @Bean
    public ModelStore modelStore(ModelStateCodec codec) {
        return new ModelStore(codec);
    }
}
