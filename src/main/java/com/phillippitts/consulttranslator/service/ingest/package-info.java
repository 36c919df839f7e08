/**
 * Parsing of streaming recognizer result messages into {@link com.phillippitts.consulttranslator.domain.Token}s.
 */
package com.phillippitts.consulttranslator.service.ingest;
