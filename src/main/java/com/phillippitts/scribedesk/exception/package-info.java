/**
 * Typed failure hierarchy for session commands.
 *
 * <p>Every exception extends {@link com.phillippitts.scribedesk.exception.ScribeDeskException}
 * and carries a {@link com.phillippitts.scribedesk.exception.FailureKind} so callers (and the
 * REST boundary) can distinguish capture, model-load, recognition, export and
 * invalid-operation failures without parsing messages.
 *
 * @since 1.0
 */
package com.phillippitts.scribedesk.exception;
