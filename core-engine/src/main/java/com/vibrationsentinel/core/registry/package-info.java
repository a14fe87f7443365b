/**
 * Loading of offline-trained artifacts: normalization statistics and the
 * persisted forms of the three detectors.
 */
package com.vibrationsentinel.core.registry;
