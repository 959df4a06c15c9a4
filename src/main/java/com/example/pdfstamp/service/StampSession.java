package com.example.pdfstamp.service;

import com.example.pdfstamp.core.DragStateMachine;
import com.example.pdfstamp.core.PlacementState;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.StampResolution;
import lombok.Getter;
import lombok.Setter;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 交互式盖章会话
 *
 * 摆放状态只由拖拽状态机和缩放设置修改；会话上的所有操作由
 * {@link StampSessionService} 在会话对象上加锁串行执行，保存过程中到达的拖拽事件会等待保存完成。
 */
@Getter
public class StampSession {
    private final String id;
    private final Path directory;
    private final Path input;
    private final Path stamp;
    private final String inputName;
    private final String stampName;
    private final BufferedImage stampImage;
    private final StampResolution resolution;
    private final int page;
    private final int pageNumber;
    private final PageGeometry geometry;
    private final int previewDensity;
    private final BufferedImage pageImage;
    private final PlacementState placement;
    private final DragStateMachine dragStateMachine;
    private final AtomicLong previewVersion = new AtomicLong();

    @Setter
    private String lastOutput;

    public StampSession(
            String id,
            Path directory,
            Path input,
            Path stamp,
            String inputName,
            String stampName,
            BufferedImage stampImage,
            StampResolution resolution,
            int page,
            int pageNumber,
            PageGeometry geometry,
            int previewDensity,
            BufferedImage pageImage,
            PlacementState placement) {
        this.id = id;
        this.directory = directory;
        this.input = input;
        this.stamp = stamp;
        this.inputName = inputName;
        this.stampName = stampName;
        this.stampImage = stampImage;
        this.resolution = resolution;
        this.page = page;
        this.pageNumber = pageNumber;
        this.geometry = geometry;
        this.previewDensity = previewDensity;
        this.pageImage = pageImage;
        this.placement = placement;
        this.dragStateMachine = new DragStateMachine(placement, previewDensity, previewVersion::incrementAndGet);
    }
}
