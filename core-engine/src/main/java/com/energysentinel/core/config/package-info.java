/**
 * Typed engine configuration.
 *
 * <p>
 * {@link com.energysentinel.core.config.EngineConfigLoader} binds a YAML
 * document (default: {@code engine.yml} on the classpath) to
 * {@link com.energysentinel.core.config.EngineConfig} and validates it once
 * at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.energysentinel.core.config;
