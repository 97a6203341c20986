package com.lore.config;

import com.lore.agentic.service.retrieval.DocumentSearchPort;
import com.lore.agentic.service.retrieval.EmptyDocumentSearch;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalConfiguration {

    /**
     * 没有接入向量库时使用空实现
     */
    @Bean
    @ConditionalOnMissingBean(DocumentSearchPort.class)
    public DocumentSearchPort documentSearchPort() {
        return new EmptyDocumentSearch();
    }
}
