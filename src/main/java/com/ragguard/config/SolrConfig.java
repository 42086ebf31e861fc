package com.ragguard.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Apache Solr client for the secondary search index
 */
@Configuration
public class SolrConfig {

    @Value("${solr.host:http://localhost:8983/solr}")
    private String solrHost;

    @Value("${solr.collection:documents}")
    private String collection;

    @Value("${solr.connection-timeout-ms:10000}")
    private int connectionTimeout;

    @Value("${solr.request-timeout-ms:30000}")
    private int requestTimeout;

    @Bean(destroyMethod = "close")
    public SolrClient solrClient() {
        String solrUrl = solrHost + "/" + collection;

        return new Http2SolrClient.Builder(solrUrl)
                .withConnectionTimeout(connectionTimeout, TimeUnit.MILLISECONDS)
                .withRequestTimeout(requestTimeout, TimeUnit.MILLISECONDS)
                .build();
    }
}
