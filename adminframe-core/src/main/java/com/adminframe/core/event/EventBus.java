package com.adminframe.core.event;

import com.adminframe.api.event.AdminEvent;
import com.adminframe.api.event.AdminEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 框架内部事件总线
 * <p>
 * 同步派发，按订阅顺序调用；监听器按事件类型（含子类型）匹配。
 */
@Slf4j
public class EventBus {

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    /**
     * 订阅事件
     *
     * @return 订阅句柄，用于取消订阅
     */
    public <E extends AdminEvent> Subscription subscribe(Class<E> eventType, AdminEventListener<E> listener) {
        Registration<E> registration = new Registration<>(eventType, listener);
        registrations.add(registration);
        log.debug("[AdminFrame] Subscribed to {}", eventType.getSimpleName());
        return () -> registrations.remove(registration);
    }

    /**
     * 发布事件
     * <p>
     * 监听器抛出的异常会被记录，不会中断其他监听器。
     */
    @SuppressWarnings("unchecked")
    public void publish(AdminEvent event) {
        log.debug("[AdminFrame] Publishing event: {}", event);

        for (Registration<?> registration : registrations) {
            if (registration.eventType.isInstance(event)) {
                try {
                    ((Registration<AdminEvent>) registration).listener.onEvent(event);
                } catch (Exception e) {
                    log.error("[AdminFrame] Error handling event {}: {}",
                            event.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }

    public int getSubscriptionCount() {
        return registrations.size();
    }

    /**
     * 订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Registration<E extends AdminEvent>(
            Class<E> eventType,
            AdminEventListener<E> listener
    ) {
    }
}
