/**
 * Error taxonomy shared by every engine component.
 *
 * <p>
 * All exceptions extend {@link com.energysentinel.core.error.EngineException}
 * and expose a stable {@link com.energysentinel.core.error.ErrorKind}.
 * </p>
 *
 * @since 1.0.0
 */
package com.energysentinel.core.error;
