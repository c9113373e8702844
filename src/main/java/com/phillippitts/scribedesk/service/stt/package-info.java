/**
 * Streaming speech recognition.
 *
 * <p>{@link com.phillippitts.scribedesk.service.stt.RecognitionEngine} is the seam the session
 * depends on; {@link com.phillippitts.scribedesk.service.stt.AbstractRecognitionEngine} holds the
 * shared lifecycle and the Vosk implementation lives in {@code stt.vosk}.
 */
package com.phillippitts.scribedesk.service.stt;
