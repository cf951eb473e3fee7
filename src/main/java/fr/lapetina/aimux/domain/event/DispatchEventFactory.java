package fr.lapetina.aimux.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link DispatchEvent} slots for the metrics ring buffer.
 */
public final class DispatchEventFactory implements EventFactory<DispatchEvent> {

    @Override
    public DispatchEvent newInstance() {
        return new DispatchEvent();
    }
}
