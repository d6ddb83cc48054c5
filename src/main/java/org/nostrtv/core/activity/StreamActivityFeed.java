package org.nostrtv.core.activity;

import org.nostrtv.core.model.ChatMessage;
import org.nostrtv.core.model.ZapReceipt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recent activity of one stream, ready for display: the newest chat messages oldest first, and
 * the newest zaps newest first. Duplicates (same event id) are ignored.
 */
public class StreamActivityFeed implements ActivityHandler {

    public static final int MAX_MESSAGES = 50;
    public static final int MAX_ZAPS = 50;

    private final Object lock = new Object();
    private final List<ChatMessage> messages = new ArrayList<>();
    private final List<ZapReceipt> zaps = new ArrayList<>();
    private volatile Runnable changeListener;

    /**
     * Called after every accepted message or zap, on the delivering thread.
     */
    public void setChangeListener(Runnable changeListener) {
        this.changeListener = changeListener;
    }

    @Override
    public void onChatMessage(ChatMessage message) {
        synchronized (lock) {
            for (ChatMessage existing : messages) {
                if (existing.getId().equals(message.getId())) {
                    return;
                }
            }
            messages.add(message);
            messages.sort(Comparator.comparingLong(ChatMessage::getCreatedAt));
            while (messages.size() > MAX_MESSAGES) {
                messages.remove(0);
            }
        }
        changed();
    }

    @Override
    public void onZapReceipt(ZapReceipt zap) {
        synchronized (lock) {
            for (ZapReceipt existing : zaps) {
                if (existing.getId().equals(zap.getId())) {
                    return;
                }
            }
            zaps.add(zap);
            zaps.sort(Comparator.comparingLong(ZapReceipt::getCreatedAt).reversed());
            while (zaps.size() > MAX_ZAPS) {
                zaps.remove(zaps.size() - 1);
            }
        }
        changed();
    }

    public List<ChatMessage> getChatMessages() {
        synchronized (lock) {
            return new ArrayList<>(messages);
        }
    }

    public List<ZapReceipt> getZapReceipts() {
        synchronized (lock) {
            return new ArrayList<>(zaps);
        }
    }

    /**
     * Sum of the retained zaps in sats.
     */
    public long getTotalZapSats() {
        synchronized (lock) {
            long total = 0;
            for (ZapReceipt zap : zaps) {
                total += zap.getAmountSats();
            }
            return total;
        }
    }

    public void clear() {
        synchronized (lock) {
            messages.clear();
            zaps.clear();
        }
        changed();
    }

    private void changed() {
        Runnable listener = changeListener;
        if (listener != null) {
            listener.run();
        }
    }
}
