package io.github.cyfko.torm.spring.autoconfigure;

import io.github.cyfko.torm.core.Torm;
import io.github.cyfko.torm.core.config.TormConfig;
import io.github.cyfko.torm.core.spi.DocumentRepository;
import io.github.cyfko.torm.core.spi.IdGenerator;
import io.github.cyfko.torm.kv.InMemoryKeyValueStore;
import io.github.cyfko.torm.kv.KeyValueDocumentRepository;
import io.github.cyfko.torm.kv.KeyValueStore;
import io.github.cyfko.torm.kv.codec.DocumentJsonCodec;
import io.github.cyfko.torm.spring.support.ModelDefinition;
import io.github.cyfko.torm.spring.support.ModelRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.stream.Collectors;
import java.util.logging.Logger;

/**
 * Registers TORM's default beans. Every bean backs off when the application defines its own.
 * <ul>
 *   <li>{@link KeyValueStore}: in-memory store</li>
 *   <li>{@link DocumentRepository}: JSON documents over the store</li>
 *   <li>{@link TormConfig}: from {@link TormProperties}, plus a {@link Clock} or {@link IdGenerator} bean if present</li>
 *   <li>{@link Torm} and a {@link ModelRegistry} holding every {@link ModelDefinition} bean</li>
 * </ul>
 */
@AutoConfiguration
@ConditionalOnClass(Torm.class)
@EnableConfigurationProperties(TormProperties.class)
public class TormAutoConfiguration {

    private static final Logger log = Logger.getLogger(TormAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentJsonCodec documentJsonCodec() {
        return new DocumentJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentRepository documentRepository(KeyValueStore store, DocumentJsonCodec codec) {
        return new KeyValueDocumentRepository(store, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public TormConfig tormConfig(TormProperties properties, ObjectProvider<Clock> clock, ObjectProvider<IdGenerator> idGenerator) {
        TormConfig.Builder builder = TormConfig.builder()
                .namespace(properties.getNamespace())
                .validateOnWrite(properties.isValidateOnWrite());
        clock.ifAvailable(builder::clock);
        idGenerator.ifAvailable(builder::idGenerator);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Torm torm(DocumentRepository repository, TormConfig config) {
        log.info(() -> String.format("TORM ready: namespace=%s, validateOnWrite=%s",
                config.getNamespace(), config.isValidateOnWrite()));
        return new Torm(repository, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelRegistry modelRegistry(Torm torm, ObjectProvider<ModelDefinition> definitions) {
        ModelRegistry registry = new ModelRegistry(torm, definitions.orderedStream().collect(Collectors.toList()));
        log.fine(() -> "Registered models: " + registry.getModels().keySet());
        return registry;
    }
}
