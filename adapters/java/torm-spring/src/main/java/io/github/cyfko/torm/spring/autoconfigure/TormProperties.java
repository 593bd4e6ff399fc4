package io.github.cyfko.torm.spring.autoconfigure;

import io.github.cyfko.torm.core.config.TormConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code torm.*} settings.
 *
 * <pre>
 * torm.namespace=shop
 * torm.validate-on-write=true
 * </pre>
 */
@ConfigurationProperties(prefix = "torm")
public class TormProperties {

    /** First segment of every document key. */
    private String namespace = TormConfig.DEFAULT_NAMESPACE;

    /** Whether models validate writes unless a model says otherwise. */
    private boolean validateOnWrite = true;

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isValidateOnWrite() {
        return validateOnWrite;
    }

    public void setValidateOnWrite(boolean validateOnWrite) {
        this.validateOnWrite = validateOnWrite;
    }
}
