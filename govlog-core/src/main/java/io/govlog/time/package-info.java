/**
 * Clock and id sources used to stamp candidates.
 */
package io.govlog.time;
