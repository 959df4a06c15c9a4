package com.example.pdfstamp.core;

import com.example.pdfstamp.model.DensitySource;
import com.example.pdfstamp.model.Invocation;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.StampResolution;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将当前会话状态输出为最小的命令行参数列表，可原样用于批处理模式
 */
public final class InvocationSerializer {

    public static final String INPUT = "--input";
    public static final String STAMP = "--stamp";
    public static final String STAMP_DPI = "--stamp-dpi";
    public static final String PAGE = "--page";
    public static final String X = "--x";
    public static final String Y = "--y";
    public static final String SCALE = "--scale";
    public static final String OUTPUT = "--output";

    private InvocationSerializer() {
    }

    /**
     * 位置取已提交位置(含进行中的拖拽偏移)，DPI仅在显式指定时输出
     */
    public static Invocation serialize(
            Path input,
            Path stamp,
            StampResolution resolution,
            int page,
            PlacementSnapshot placement,
            Path output) {

        List<Invocation.Argument> args = new ArrayList<>();
        args.add(new Invocation.Argument(INPUT, input.toString()));
        args.add(new Invocation.Argument(STAMP, stamp.toString()));
        if (resolution != null && resolution.getSource() == DensitySource.EXPLICIT) {
            args.add(new Invocation.Argument(STAMP_DPI, format("%1.1f", resolution.getDensityPerInch())));
        }
        if (page != 1) {
            args.add(new Invocation.Argument(PAGE, Integer.toString(page)));
        }
        double x = placement.getCurrentXMM();
        double y = placement.getCurrentYMM();
        if (x != 0.0) {
            args.add(new Invocation.Argument(X, format("%1.1f", x)));
        }
        if (y != 0.0) {
            args.add(new Invocation.Argument(Y, format("%1.1f", y)));
        }
        if (placement.getScale() != 1.0) {
            args.add(new Invocation.Argument(SCALE, format("%1.3f", placement.getScale())));
        }
        if (output != null) {
            args.add(new Invocation.Argument(OUTPUT, output.toString()));
        }
        return new Invocation(args);
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
