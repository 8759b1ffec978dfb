package io.github.vevoly.jscopedcache.core.hooks;

import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.api.constants.CacheTypes;

/**
 * 消息写入后的失效钩子：清除发送者的消息列表以及收件人、课程、监护人列表和仪表盘。
 * <p>
 * Hook run after a message was written: clears the sender's message list plus the recipient, course and guardian lists
 * and the dashboards.
 *
 * @author vevoly
 */
public class MessageInvalidationHook extends AbstractInvalidationHook {

    public MessageInvalidationHook(ScopedCacheInvalidator invalidator) {
        super(invalidator);
    }

    public int onMessageWritten(String userId, String schoolId) {
        return guarded("message-write", () -> invalidator.invalidate(CacheTypes.MESSAGES, userId, schoolId,
                CacheTypes.MESSAGE_RELATED_GROUP));
    }
}
