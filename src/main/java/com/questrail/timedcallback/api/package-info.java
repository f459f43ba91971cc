/**
 * Timed Callback API
 * =============================================================================
 *
 * Types shared between the scheduler core and its collaborators: the
 * {@link com.questrail.timedcallback.api.CallbackInvoker} port implemented by
 * the scripting runtime, and the small enums callers pass when changing the
 * state of scheduled callbacks.
 *
 * <p>Nothing in this package depends on the core. Binding layers that marshal
 * script arguments may depend on this package alone.</p>
 */
package com.questrail.timedcallback.api;
