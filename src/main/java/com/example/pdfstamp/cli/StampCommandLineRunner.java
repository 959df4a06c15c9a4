package com.example.pdfstamp.cli;

import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.model.StampJob;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.service.PdfStampService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 批处理模式
 *
 * 参数：
 *   --input      PDF输入文件(必填)
 *   --stamp      图章图片(必填)
 *   --stamp-dpi  图章DPI，0表示读取图片元数据(默认0)
 *   --page       盖章页码，负数从末尾倒数(默认1)
 *   --x / --y    图章位置，单位毫米，从左到右/从上到下(默认0)
 *   --scale      图章缩放比例(默认1)
 *   --output     输出文件，默认 "输入文件名_sig.pdf"
 *
 * 没有 --input 参数时不执行，应用以Web服务方式运行。
 */
@Slf4j
@Component
public class StampCommandLineRunner implements ApplicationRunner {

    @Autowired
    private PdfStampService pdfStampService;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("input")) {
            return;
        }
        Map<String, String> options = options(args.getSourceArgs());
        StampJob job = parse(options);
        StampResult result = pdfStampService.stamp(job);
        for (String warning : result.getWarnings()) {
            log.warn(warning);
        }
        log.info("已在第 {} 页盖章，输出: {}", result.getPageNumber(), result.getFileName());
    }

    /**
     * 同时支持 "--name value" 和 "--name=value"，重复出现时以最后一次为准
     */
    static Map<String, String> options(String[] sourceArgs) {
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < sourceArgs.length; i++) {
            String arg = sourceArgs[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new ConfigException("无法识别的参数: " + arg);
            }
            String name = arg.substring(2);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                options.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (i + 1 < sourceArgs.length && !isFlag(sourceArgs[i + 1])) {
                options.put(name, sourceArgs[++i]);
            } else {
                options.put(name, "");
            }
        }
        return options;
    }

    static StampJob parse(Map<String, String> options) {
        Path input = Paths.get(required(options, "input"));
        Path stamp = Paths.get(required(options, "stamp"));

        double stampDpi = doubleOption(options, "stamp-dpi", 0.0);
        if (stampDpi < 0.0) {
            throw new ConfigException("--stamp-dpi 不能为负数: " + stampDpi);
        }
        int page = intOption(options, "page", 1);
        if (page == 0) {
            throw new ConfigException("--page 不能为0");
        }
        String output = options.get("output");

        return StampJob.builder()
                .input(input)
                .stamp(stamp)
                .stampDpi(stampDpi > 0.0 ? stampDpi : null)
                .page(page)
                .x(doubleOption(options, "x", 0.0))
                .y(doubleOption(options, "y", 0.0))
                .scale(doubleOption(options, "scale", 1.0))
                .output(output == null || output.isBlank() ? null : Paths.get(output))
                .build();
    }

    // 负数是取值而不是参数名
    private static boolean isFlag(String arg) {
        return arg.startsWith("--") && arg.length() > 2 && !Character.isDigit(arg.charAt(2));
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new ConfigException("缺少参数 --" + name);
        }
        return value;
    }

    private static double doubleOption(Map<String, String> options, String name, double defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("--" + name + " 不是有效的数字: " + value);
        }
    }

    private static int intOption(Map<String, String> options, String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("--" + name + " 不是有效的整数: " + value);
        }
    }
}
