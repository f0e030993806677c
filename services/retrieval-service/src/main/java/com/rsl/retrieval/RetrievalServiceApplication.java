package com.rsl.retrieval;

import com.rsl.retrieval.access.AccessProperties;
import com.rsl.retrieval.index.IndexerProperties;
import com.rsl.retrieval.relevance.RelevanceProperties;
import com.rsl.retrieval.resilience.ResilienceProperties;
import com.rsl.retrieval.search.SearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    AccessProperties.class,
    RelevanceProperties.class,
    SearchProperties.class,
    ResilienceProperties.class,
    IndexerProperties.class
})
public class RetrievalServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RetrievalServiceApplication.class, args);
    }
}
