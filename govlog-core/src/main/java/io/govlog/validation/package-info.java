/**
 * Pure invariant checks run against a candidate before it is admitted.
 */
package io.govlog.validation;
