package com.advisorplatform.orchestrator.stream;

import com.advisorplatform.common.model.StreamEvent;
import com.advisorplatform.common.model.StreamEventType;

/**
 * Where the orchestrator publishes its events. The sink assigns sequence numbers and
 * discards anything emitted after a terminal event.
 */
public interface AdvisoryEventSink {

    /**
     * @return the enveloped event, or {@code null} if the stream had already terminated
     */
    StreamEvent emit(StreamEventType type, Object payload);
}
