/**
 * Presentation layer: REST controllers and exception mapping. Depends on the service layer only.
 */
package com.phillippitts.scribedesk.presentation;
