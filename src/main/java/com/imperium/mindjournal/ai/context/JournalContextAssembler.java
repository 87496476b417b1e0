package com.imperium.mindjournal.ai.context;

import com.imperium.mindjournal.persistence.PersistenceGateway;
import com.imperium.mindjournal.policy.JournalContextPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 从用户最近的日记中拼出一段上下文，注入到推理 prompt。
 * <p>
 * 没有符合条件的日记时返回空，不视为错误，推理照常进行。
 */
@Component
public class JournalContextAssembler {

    private final PersistenceGateway persistenceGateway;
    private final int windowDays;
    private final int maxEntries;

    public JournalContextAssembler(PersistenceGateway persistenceGateway,
            @Value("${app.chat.context.window-days:" + JournalContextPolicy.DEFAULT_WINDOW_DAYS + "}") int windowDays,
            @Value("${app.chat.context.max-entries:" + JournalContextPolicy.DEFAULT_MAX_ENTRIES + "}") int maxEntries) {
        this.persistenceGateway = persistenceGateway;
        this.windowDays = Math.max(0, windowDays);
        this.maxEntries = Math.max(0, maxEntries);
    }

    /**
     * @param userId        用户ID
     * @param referenceTime 窗口终点，一般为当前时间
     * @return 最近 maxEntries 条日记正文（新的在前），以换行拼接
     */
    public Optional<String> assemble(String userId, LocalDateTime referenceTime) {
        if (maxEntries == 0) {
            return Optional.empty();
        }
        LocalDateTime since = referenceTime.minusDays(windowDays);
        List<String> recent = persistenceGateway.findRecentJournalText(userId, since);
        if (recent == null || recent.isEmpty()) {
            return Optional.empty();
        }
        List<String> picked = recent.stream()
                .filter(text -> text != null && !text.isBlank())
                .limit(maxEntries)
                .toList();
        if (picked.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("\n", picked));
    }
}
