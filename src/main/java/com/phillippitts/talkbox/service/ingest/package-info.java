/**
 * Producer-side ingestion: the {@link com.phillippitts.talkbox.service.adapter.InboundEventHandler}
 * implementation adapters call into.
 */
package com.phillippitts.talkbox.service.ingest;
