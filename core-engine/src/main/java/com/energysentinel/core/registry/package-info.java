/**
 * Versioned persistence of trained forecasters, the training history ledger
 * and the promote or roll back decision.
 */
package com.energysentinel.core.registry;
