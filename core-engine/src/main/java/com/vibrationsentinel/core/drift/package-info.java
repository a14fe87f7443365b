/**
 * Distribution drift monitoring of normalized features against the healthy
 * reference, using the Population Stability Index.
 */
package com.vibrationsentinel.core.drift;
