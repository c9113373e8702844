/**
 * REST endpoints standing in for the desktop controls: start/stop, speakers, transcript edits,
 * notes and export.
 */
package com.phillippitts.scribedesk.presentation.controller;
