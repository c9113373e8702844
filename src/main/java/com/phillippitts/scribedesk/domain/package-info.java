/**
 * Domain values of a transcription session.
 *
 * <p>All types are immutable records; mutable session state (speaker names, edited text, note
 * bodies) changes by replacing values inside the owning store, never by mutating a value that
 * another component may hold.
 *
 * <ul>
 *   <li>{@link com.phillippitts.scribedesk.domain.Speaker} - stable id plus display name/colour</li>
 *   <li>{@link com.phillippitts.scribedesk.domain.Segment} - closed, time-bounded transcript unit</li>
 *   <li>{@link com.phillippitts.scribedesk.domain.Note} - annotation over a frozen
 *       {@link com.phillippitts.scribedesk.domain.NoteSnapshot}</li>
 *   <li>{@link com.phillippitts.scribedesk.domain.RecognitionEvent} - partial/final recognizer output</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scribedesk.domain;
