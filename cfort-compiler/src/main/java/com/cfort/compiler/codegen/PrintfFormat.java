package com.cfort.compiler.codegen;

import com.cfort.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * printf 格式串的分段结果：字面文本、转换说明与内部换行。
 * 末尾的换行不作为分段保存，而是决定 write 是否推进记录。
 */
public final class PrintfFormat {

    public enum SegmentKind {
        TEXT,
        CONVERSION,
        NEWLINE
    }

    /**
     * 转换说明按输出方式归类
     */
    public enum Conversion {
        SIGNED,     // %d %i %ld %lld
        UNSIGNED,   // %u %lu %llu
        REAL,       // %f %lf
        STRING      // %s
    }

    public static final class Segment {
        private final SegmentKind kind;
        private final String text;
        private final Conversion conversion;

        private Segment(SegmentKind kind, String text, Conversion conversion) {
            this.kind = kind;
            this.text = text;
            this.conversion = conversion;
        }

        public SegmentKind getKind() {
            return kind;
        }

        /** TEXT 的内容，或 CONVERSION 在源码中的写法（如 {@code %llu}） */
        public String getText() {
            return text;
        }

        public Conversion getConversion() {
            return conversion;
        }
    }

    private final List<Segment> segments;
    private final boolean advancing;

    private PrintfFormat(List<Segment> segments, boolean advancing) {
        this.segments = segments;
        this.advancing = advancing;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    /** 格式串以换行结尾时为 true */
    public boolean isAdvancing() {
        return advancing;
    }

    public int getConversionCount() {
        int count = 0;
        for (Segment s : segments) {
            if (s.kind == SegmentKind.CONVERSION) count++;
        }
        return count;
    }

    /**
     * 解析已去除转义的格式串
     *
     * @throws GenException 遇到不支持的转换说明（宽度、精度、标志、%c、%x 等）
     */
    public static PrintfFormat parse(String format, SourceLocation location) {
        boolean advancing = format.endsWith("\n");
        String body = advancing ? format.substring(0, format.length() - 1) : format;

        List<Segment> segments = new ArrayList<Segment>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\n') {
                flushText(text, segments);
                segments.add(new Segment(SegmentKind.NEWLINE, "\n", null));
                i++;
                continue;
            }
            if (c != '%') {
                text.append(c);
                i++;
                continue;
            }
            int start = i++;
            if (i < body.length() && body.charAt(i) == '%') {
                text.append('%');
                i++;
                continue;
            }
            int longs = 0;
            while (i < body.length() && body.charAt(i) == 'l' && longs < 2) {
                longs++;
                i++;
            }
            if (i >= body.length()) {
                throw new GenException("Incomplete printf conversion '" + body.substring(start) + "'", location);
            }
            char conv = body.charAt(i++);
            String spec = body.substring(start, i);
            Conversion conversion;
            switch (conv) {
                case 'd':
                case 'i':
                    conversion = Conversion.SIGNED;
                    break;
                case 'u':
                    conversion = Conversion.UNSIGNED;
                    break;
                case 'f':
                    if (longs > 1) {
                        throw new GenException("Unsupported printf conversion '" + spec + "'", location);
                    }
                    conversion = Conversion.REAL;
                    break;
                case 's':
                    if (longs > 0) {
                        throw new GenException("Unsupported printf conversion '" + spec + "'", location);
                    }
                    conversion = Conversion.STRING;
                    break;
                default:
                    throw new GenException("Unsupported printf conversion '" + spec
                            + "' (only %d %i %u %f %s with l/ll and %% are translated)", location);
            }
            flushText(text, segments);
            segments.add(new Segment(SegmentKind.CONVERSION, spec, conversion));
        }
        flushText(text, segments);
        return new PrintfFormat(Collections.unmodifiableList(segments), advancing);
    }

    private static void flushText(StringBuilder text, List<Segment> segments) {
        if (text.length() > 0) {
            segments.add(new Segment(SegmentKind.TEXT, text.toString(), null));
            text.setLength(0);
        }
    }
}
