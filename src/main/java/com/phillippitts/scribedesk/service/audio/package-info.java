/**
 * Audio format contract and microphone capture.
 *
 * <p>Frames produced by {@link com.phillippitts.scribedesk.service.audio.capture.AudioCaptureSource}
 * are raw PCM in the format described by {@link com.phillippitts.scribedesk.service.audio.AudioFormat};
 * no WAV header is ever attached.
 */
package com.phillippitts.scribedesk.service.audio;
