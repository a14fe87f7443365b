/**
 * Remaining-useful-life projection from the health-score trend.
 */
package com.vibrationsentinel.core.rul;
