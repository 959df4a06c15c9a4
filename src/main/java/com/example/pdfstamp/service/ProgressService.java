package com.example.pdfstamp.service;

import com.example.pdfstamp.splice.SpliceProgressListener;
import com.example.pdfstamp.splice.SpliceStep;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class ProgressService {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError((error) -> emitters.remove(emitter));

        return emitter;
    }

    public void sendProgress(String message) {
        send("progress", message);
    }

    public void sendWarning(String message) {
        send("warning", message);
    }

    /**
     * 将拼接步骤转发为进度消息
     */
    public SpliceProgressListener spliceListener(String fileName) {
        return (SpliceStep step) -> sendProgress(fileName + ": " + step.getDescription());
    }

    private void send(String event, Object data) {
        emitters.forEach(emitter -> {
            try {
                emitter.send(SseEmitter.event().name(event).data(data));
            } catch (IOException e) {
                emitter.complete();
                emitters.remove(emitter);
            }
        });
    }
}
