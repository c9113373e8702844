/**
 * Maps typed session failures to HTTP responses.
 */
package com.phillippitts.scribedesk.presentation.exception;
