/**
 * Feature standardization against statistics fit on healthy data.
 */
package com.vibrationsentinel.core.normalization;
