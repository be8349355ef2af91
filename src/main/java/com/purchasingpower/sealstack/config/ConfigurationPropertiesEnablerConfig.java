package com.purchasingpower.sealstack.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Configuration class that enables all @ConfigurationProperties classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link SealStackProperties} - pattern table and query interpretation settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    SealStackProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
