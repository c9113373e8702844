/**
 * Vosk (offline Kaldi) streaming recognizer integration.
 *
 * <p>Native resources are confined to {@link com.phillippitts.scribedesk.service.stt.vosk.NativeVoskRecognizer};
 * everything else talks to the {@link com.phillippitts.scribedesk.service.stt.vosk.VoskRecognizer} seam.
 */
package com.phillippitts.scribedesk.service.stt.vosk;
