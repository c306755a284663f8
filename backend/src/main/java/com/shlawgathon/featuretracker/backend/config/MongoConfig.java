package com.shlawgathon.featuretracker.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

@Configuration
public class MongoConfig {

    /**
     * Tag names such as "Next.js" are keys of the subtag reverse index, so dots in map keys are escaped.
     */
    public static final String MAP_KEY_DOT_REPLACEMENT = "．";

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoDatabaseFactory mongoDbFactory,
            MongoMappingContext mappingContext,
            MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(
                new DefaultDbRefResolver(mongoDbFactory), mappingContext);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
