package com.switchyard.core.queue;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

public class QueueFullException extends RouterException {

    public QueueFullException(int capacity) {
        super(ErrorKind.QUEUE_FULL, "Offline queue is full (" + capacity + " pending jobs)");
    }
}
