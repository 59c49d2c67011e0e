package com.scholary.transcripthub.config;

import com.scholary.transcripthub.evaluation.EvaluationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EvaluationProperties.class)
public class EvaluationConfig {}
