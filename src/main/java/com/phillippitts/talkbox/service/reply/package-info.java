/**
 * Reply generation seam. The core ships no implementation; applications contribute a
 * {@link com.phillippitts.talkbox.service.reply.ReplyGenerator} bean.
 */
package com.phillippitts.talkbox.service.reply;
