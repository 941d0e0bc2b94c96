/**
 * Typed governance event payloads and their stored form.
 */
package io.govlog.event;
