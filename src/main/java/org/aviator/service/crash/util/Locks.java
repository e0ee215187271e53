package org.aviator.service.crash.util;

import org.springframework.stereotype.Component;

import java.util.Objects;

// Verrous par bandes : un même id retombe toujours sur le même moniteur
@Component
public class Locks {
    private final Object[] userStripes = new Object[128];
    private final Object[] betStripes = new Object[256];

    public Locks() {
        for (int i = 0; i < userStripes.length; i++) userStripes[i] = new Object();
        for (int i = 0; i < betStripes.length; i++) betStripes[i] = new Object();
    }

    public Object ofUser(Long userId) {
        return userStripes[index(userId, userStripes.length)];
    }

    public Object ofBet(Long betId) {
        return betStripes[index(betId, betStripes.length)];
    }

    private static int index(Long id, int size) {
        return (Objects.hashCode(id) & 0x7fffffff) & (size - 1);
    }
}
