package com.cfort.compiler.codegen;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.LocalDecl;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.decl.ConstantDecl;
import com.cfort.compiler.ast.decl.FunctionDecl;
import com.cfort.compiler.ast.decl.Parameter;
import com.cfort.compiler.ast.decl.Program;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;
import com.cfort.compiler.codegen.ExpressionRenderer.Code;
import com.cfort.compiler.pass.ReservedNames;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fortran 代码生成器
 *
 * <p>输入是经过规范化与声明提升的翻译单元。输出布局：头部注释，一个容纳常量与 main 以外全部函数的模块，
 * 然后是 {@code use} 该模块的主程序。Fortran 无法等价表达的构造抛出 {@link GenException}。</p>
 */
public class FortranGenerator {
    private static final Logger LOG = Logger.getLogger(FortranGenerator.class.getName());

    private static final Pattern FORTRAN_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,62}");
    private static final Pattern SCANF_FORMAT = Pattern.compile("(%(ll|l)?[diu])+");
    private static final Pattern SCANF_CONVERSION = Pattern.compile("%(ll|l)?[diu]");

    private final GeneratorConfig config;

    public FortranGenerator(GeneratorConfig config) {
        this.config = config;
    }

    public FortranGenerator() {
        this(new GeneratorConfig());
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    /**
     * 生成完整的 Fortran 源文件
     */
    public String generate(TranslationUnit unit) {
        long start = System.nanoTime();
        checkNames(unit);

        Map<String, FunctionUnit> functions = new HashMap<String, FunctionUnit>();
        for (FunctionUnit fn : unit.getAllFunctions()) {
            if (!fn.isHoisted()) {
                throw new IllegalArgumentException("Function '" + fn.getName() + "' has not been hoisted");
            }
            functions.put(fn.getName(), fn);
        }
        CallGraph calls = new CallGraph(unit);

        // 先生成全部函数体，才知道要哪些辅助函数、是否读取输入
        Set<String> helpers = new HashSet<String>();
        List<String> procedures = new ArrayList<String>();
        boolean readsInput = false;
        for (FunctionUnit fn : unit.getFunctions()) {
            FortranWriter procedure = new FortranWriter(config, 1);
            readsInput |= emitProcedure(fn, unit, functions, helpers, calls.isRecursive(fn.getName()), procedure);
            procedures.add(procedure.getOutput());
        }
        FunctionEmitter emitter = new FunctionEmitter(unit.getMain(), unit, functions, helpers, 1);
        String body = emitter.emitBody();
        List<String> declarations = emitter.declarationLines();
        readsInput |= emitter.readsInput();

        FortranWriter out = new FortranWriter(config);
        if (config.isEmitHeader()) {
            out.comment("Translated from " + unit.getFileName() + " by cfort");
            for (String include : unit.getIncludes()) {
                out.comment("#include <" + include + ">");
            }
            if (readsInput) {
                out.comment("Input: every scanf call reads one whole line (list-directed read);"
                        + " values left on that line are skipped");
            }
            out.blankLine();
        }

        boolean hasModule = !unit.getConstants().isEmpty() || !procedures.isEmpty() || !helpers.isEmpty();
        if (hasModule) {
            out.line("module " + config.getModuleName());
            out.indent();
            out.line("implicit none");
            for (ConstantDecl c : unit.getConstants()) {
                out.line(constantDeclaration(c));
            }
            out.dedent();
            if (!procedures.isEmpty() || !helpers.isEmpty()) {
                out.line("contains");
                for (String procedure : procedures) {
                    out.blankLine();
                    out.appendRaw(procedure);
                }
                out.indent();
                UnsignedHelpers.emit(helpers, out);
                out.dedent();
            }
            out.blankLine();
            out.line("end module " + config.getModuleName());
            out.blankLine();
        }

        out.line("program " + config.getProgramName());
        out.indent();
        if (hasModule) {
            out.line("use " + config.getModuleName());
        }
        out.line("implicit none");
        for (String decl : declarations) {
            out.line(decl);
        }
        if (!declarations.isEmpty() && !body.isEmpty()) {
            out.blankLine();
        }
        out.appendRaw(body);
        out.dedent();
        out.line("end program " + config.getProgramName());

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Generated %d function(s) from %s in %.2f ms",
                    unit.getAllFunctions().size(), unit.getFileName(), (System.nanoTime() - start) / 1_000_000.0));
        }
        return out.getOutput();
    }

    private String constantDeclaration(ConstantDecl c) {
        String value;
        if (c.isWide()) {
            value = c.getValue() + "_8";
        } else if (c.getValue() == Integer.MIN_VALUE) {
            value = "-huge(0) - 1";
        } else {
            value = Long.toString(c.getValue());
        }
        return ExpressionRenderer.typeSpec(c.isWide() ? CType.UINT64 : CType.INT32)
                + ", parameter :: " + c.getName() + " = " + value;
    }

    /**
     * @return 函数体中是否有 scanf
     */
    private boolean emitProcedure(FunctionUnit fn, TranslationUnit unit, Map<String, FunctionUnit> functions,
                                  Set<String> helpers, boolean recursive, FortranWriter out) {
        StringBuilder params = new StringBuilder();
        for (Parameter p : fn.getDeclaration().getParams()) {
            if (params.length() > 0) params.append(", ");
            params.append(p.getName());
        }
        String kind = fn.isSubroutine() ? "subroutine" : "function";
        StringBuilder head = new StringBuilder();
        if (recursive) {
            head.append("recursive ");
        }
        head.append(kind).append(' ').append(fn.getName()).append('(').append(params).append(')');
        if (fn.hasResult()) {
            head.append(" result(").append(fn.getResultName()).append(')');
        }
        if (recursive && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Marking '" + fn.getName() + "' recursive");
        }

        out.line(head.toString());
        out.indent();
        out.line("implicit none");
        FunctionEmitter emitter = new FunctionEmitter(fn, unit, functions, helpers, out.getIndentLevel());
        String body = emitter.emitBody();
        for (String decl : emitter.declarationLines()) {
            out.line(decl);
        }
        out.appendRaw(body);
        out.dedent();
        out.line("end " + kind + " " + fn.getName());
        return emitter.readsInput();
    }

    // ============ 名字检查 ============

    private void checkNames(TranslationUnit unit) {
        SourceLocation whole = SourceLocation.ofFile(unit.getFileName());
        checkName(config.getModuleName(), "module name", whole);
        checkName(config.getProgramName(), "program name", whole);
        if (key(config.getModuleName()).equals(key(config.getProgramName()))) {
            throw new GenException("Module and program are both named '" + config.getModuleName() + "'", whole);
        }
        Set<String> global = new HashSet<String>();
        global.add(key(config.getModuleName()));
        global.add(key(config.getProgramName()));

        for (ConstantDecl c : unit.getConstants()) {
            checkGlobalName(c.getName(), "constant", c.getLocation(), global);
        }
        for (FunctionUnit fn : unit.getAllFunctions()) {
            if (!fn.isMain()) {
                checkGlobalName(fn.getName(), "function", fn.getDeclaration().getLocation(), global);
            }
            if (fn.hasResult()) {
                checkName(fn.getResultName(), "result variable", fn.getDeclaration().getLocation());
            }
            if (fn.getDeclarations() != null) {
                for (LocalDecl decl : fn.getDeclarations()) {
                    checkName(decl.getName(), "variable", decl.getLocation());
                }
            }
        }
    }

    private void checkGlobalName(String name, String what, SourceLocation loc, Set<String> global) {
        checkName(name, what, loc);
        if (ReservedNames.INTRINSICS.contains(key(name))) {
            throw new GenException("The " + what + " '" + name
                    + "' would hide a Fortran intrinsic used by the translation", loc);
        }
        if (global.contains(key(name))) {
            throw new GenException("The " + what + " '" + name
                    + "' collides with the module or program name", loc);
        }
    }

    private static void checkName(String name, String what, SourceLocation loc) {
        if (!FORTRAN_NAME.matcher(name).matches()) {
            throw new GenException("'" + name + "' is not a valid Fortran " + what
                    + " (must start with a letter and have at most 63 characters)", loc);
        }
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    // ============ 函数体 ============

    /**
     * 单个函数（或主程序）的语句生成。语句先写入独立缓冲区，
     * 因为临时变量和 iostat 变量要在声明区补充声明。
     */
    private final class FunctionEmitter implements AstVisitor<Void, Void> {
        final FunctionUnit fn;
        final Map<String, FunctionUnit> functions;
        final FortranWriter writer;
        final ExpressionRenderer renderer;
        final NameAllocator allocator;
        final Map<String, CType> variables = new HashMap<String, CType>();
        final Map<String, CType> generated = new LinkedHashMap<String, CType>();
        final Set<String> assigned;
        String ioStatus;

        FunctionEmitter(FunctionUnit fn, TranslationUnit unit, Map<String, FunctionUnit> functions,
                        Set<String> helpers, int indentLevel) {
            this.fn = fn;
            this.functions = functions;
            this.writer = new FortranWriter(config, indentLevel);
            for (ConstantDecl c : unit.getConstants()) {
                variables.put(c.getName(), c.isWide() ? CType.UINT64 : CType.INT32);
            }
            List<String> taken = new ArrayList<String>(ReservedNames.forUnit(unit,
                    Arrays.asList(config.getModuleName(), config.getProgramName())));
            for (LocalDecl decl : fn.getDeclarations()) {
                variables.put(decl.getName(), decl.getType());
                taken.add(decl.getName());
            }
            if (fn.hasResult()) {
                variables.put(fn.getResultName(), fn.getReturnType());
            }
            this.allocator = new NameAllocator(taken);
            this.renderer = new ExpressionRenderer(variables, functions, helpers);
            this.assigned = AssignedNames.in(fn.getBody());
        }

        String emitBody() {
            fn.getBody().accept(this, null);
            return writer.getOutput();
        }

        boolean readsInput() {
            return ioStatus != null;
        }

        /**
         * 声明区：形参、结果变量、局部变量、生成器引入的变量
         */
        List<String> declarationLines() {
            List<String> lines = new ArrayList<String>();
            for (LocalDecl decl : fn.getDeclarations()) {
                if (decl.isParameter()) {
                    String attribute = assigned.contains(decl.getName()) ? "value" : "intent(in)";
                    lines.add(ExpressionRenderer.typeSpec(decl.getType()) + ", " + attribute + " :: " + decl.getName());
                }
            }
            if (fn.hasResult()) {
                lines.add(ExpressionRenderer.typeSpec(fn.getReturnType()) + " :: " + fn.getResultName());
            }
            for (LocalDecl decl : fn.getDeclarations()) {
                if (!decl.isParameter()) {
                    lines.add(declaration(decl.getName(), decl.getType()));
                }
            }
            for (Map.Entry<String, CType> entry : generated.entrySet()) {
                lines.add(declaration(entry.getKey(), entry.getValue()));
            }
            return lines;
        }

        private String declaration(String name, CType type) {
            if (type.isArray()) {
                return ExpressionRenderer.typeSpec(type.getElementType())
                        + ", dimension(0:" + (type.getSize() - 1) + ") :: " + name;
            }
            return ExpressionRenderer.typeSpec(type) + " :: " + name;
        }

        private String temporary(CType type) {
            String name = allocator.allocate(config.getTempPrefix());
            generated.put(name, type);
            return name;
        }

        private String ioStatus() {
            if (ioStatus == null) {
                ioStatus = allocator.allocate(config.getIoStatusName());
                generated.put(ioStatus, CType.INT32);
            }
            return ioStatus;
        }

        // ============ 语句 ============

        @Override
        public Void visitBlock(Block node, Void ctx) {
            for (Statement stmt : node.getStatements()) {
                stmt.accept(this, null);
            }
            return null;
        }

        @Override
        public Void visitAssignStmt(AssignStmt node, Void ctx) {
            Expression target = node.getTarget();
            if (node.getValue() instanceof ArrayLiteral) {
                emitArrayAssignment(target, (ArrayLiteral) node.getValue());
                return null;
            }
            Code lhs = renderer.render(target);
            writer.line(lhs.text + " = " + renderer.integer(node.getValue(), lhs.type));
            return null;
        }

        private void emitArrayAssignment(Expression target, ArrayLiteral values) {
            if (!(target instanceof Identifier) || !variables.containsKey(((Identifier) target).getName())
                    || !variables.get(((Identifier) target).getName()).isArray()) {
                throw new GenException("Array initializer assigned to a non-array", target.getLocation());
            }
            String name = ((Identifier) target).getName();
            CType element = variables.get(name).getElementType();
            List<String> items = new ArrayList<String>();
            boolean uniform = true;
            for (Expression value : values.getValues()) {
                String text = renderer.integer(value, element);
                if (!items.isEmpty() && !items.get(0).equals(text)) {
                    uniform = false;
                }
                items.add(text);
            }
            if (uniform && !items.isEmpty()) {
                writer.line(name + " = " + items.get(0));
            } else {
                writer.line(name + " = [" + String.join(", ", items) + "]");
            }
        }

        @Override
        public Void visitCompoundAssignStmt(CompoundAssignStmt node, Void ctx) {
            Code lhs = renderer.render(node.getTarget());
            BinaryExpr value = new BinaryExpr(node.getLocation(), node.getTarget(), node.getOperator(), node.getValue());
            writer.line(lhs.text + " = " + renderer.integer(value, lhs.type));
            return null;
        }

        @Override
        public Void visitIfStmt(IfStmt node, Void ctx) {
            IfStmt current = node;
            writer.line("if (" + ifCondition(current, false) + ") then");
            while (true) {
                writer.indent();
                current.getThenBlock().accept(this, null);
                writer.dedent();
                if (!current.hasElse()) {
                    break;
                }
                if (current.isElseIf()) {
                    current = (IfStmt) current.getElseBlock().getStatements().get(0);
                    writer.line("else if (" + ifCondition(current, true) + ") then");
                    continue;
                }
                writer.line("else");
                writer.indent();
                current.getElseBlock().accept(this, null);
                writer.dedent();
                break;
            }
            writer.line("end if");
            return null;
        }

        private String ifCondition(IfStmt node, boolean elseIf) {
            ScanfCondition scanf = ScanfCondition.find(node.getCondition());
            if (scanf == null) {
                return renderer.logical(node.getCondition()).text;
            }
            if (elseIf) {
                throw new GenException("scanf in an else-if condition is not translated", node.getLocation());
            }
            emitRead(scanf.call);
            return scanfCondition(scanf).text;
        }

        private Code scanfCondition(ScanfCondition scanf) {
            String status = ioStatus() + (scanf.success ? " == 0" : " /= 0");
            if (scanf.rest.isEmpty()) {
                return Code.condition(status, ExpressionRenderer.REL);
            }
            StringBuilder text = new StringBuilder(status);
            for (Expression operand : scanf.rest) {
                text.append(" .and. ").append(ExpressionRenderer.wrap(renderer.logical(operand), ExpressionRenderer.NOT));
            }
            return Code.condition(text.toString(), ExpressionRenderer.AND);
        }

        @Override
        public Void visitWhileStmt(WhileStmt node, Void ctx) {
            ScanfCondition scanf = ScanfCondition.find(node.getCondition());
            if (scanf != null) {
                writer.line("do");
                writer.indent();
                emitRead(scanf.call);
                if (scanf.rest.isEmpty()) {
                    writer.line("if (" + ioStatus() + (scanf.success ? " /= 0" : " == 0") + ") exit");
                } else {
                    writer.line("if (.not. (" + scanfCondition(scanf).text + ")) exit");
                }
                node.getBody().accept(this, null);
                writer.dedent();
                writer.line("end do");
                return null;
            }
            Code cond = renderer.logical(node.getCondition());
            writer.line(".true.".equals(cond.text) ? "do" : "do while (" + cond.text + ")");
            writer.indent();
            node.getBody().accept(this, null);
            writer.dedent();
            writer.line("end do");
            return null;
        }

        @Override
        public Void visitForStmt(ForStmt node, Void ctx) {
            CountedLoop loop = CountedLoop.analyze(node);
            CType type = variables.get(loop.getVariable());
            if (type == null || !type.isScalar()) {
                throw new GenException("Loop variable '" + loop.getVariable() + "' is not a scalar variable",
                        node.getLocation());
            }
            StringBuilder head = new StringBuilder("do ").append(loop.getVariable()).append(" = ")
                    .append(renderer.integer(loop.getStart(), type)).append(", ")
                    .append(renderer.integer(loop.getEnd(), type));
            if (loop.getStride() != 1) {
                head.append(", ").append(loop.getStride());
            }
            writer.line(head.toString());
            writer.indent();
            node.getBody().accept(this, null);
            writer.dedent();
            writer.line("end do");
            return null;
        }

        @Override
        public Void visitReturnStmt(ReturnStmt node, Void ctx) {
            if (!fn.isMain()) {
                if (node.hasValue()) {
                    throw new IllegalStateException("Return with a value after normalization in '" + fn.getName() + "'");
                }
                writer.line("return");
                return null;
            }
            if (!node.hasValue()) {
                writer.line("stop");
                return null;
            }
            Code code = renderer.render(node.getValue());
            if (code.literal == null) {
                throw new GenException("main may only return an integer literal before its end",
                        node.getLocation());
            }
            writer.line(code.literal == 0 ? "stop" : "stop " + code.literal);
            return null;
        }

        @Override
        public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
            Expression expr = node.getExpression();
            if (!(expr instanceof CallExpr)) {
                throw new GenException("Only calls are translated as expression statements", node.getLocation());
            }
            CallExpr call = (CallExpr) expr;
            if (call.isPrintf()) {
                emitWrite(call);
            } else if (call.isScanf()) {
                emitRead(call);
            } else {
                FunctionUnit callee = calleeOf(call);
                String text = renderer.callText(callee.getDeclaration(), call.getArgs());
                if (callee.isSubroutine()) {
                    writer.line("call " + text);
                } else {
                    String temp = temporary(callee.getReturnType());
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Discarded result of '" + callee.getName() + "' goes to '" + temp + "'");
                    }
                    writer.line(temp + " = " + text);
                }
            }
            return null;
        }

        private FunctionUnit calleeOf(CallExpr call) {
            FunctionUnit callee = functions.get(call.getCallee());
            if (callee == null) {
                throw new GenException("Call to undefined function '" + call.getCallee() + "'", call.getLocation());
            }
            return callee;
        }

        // ============ printf / scanf ============

        private void emitWrite(CallExpr call) {
            String format = ((Literal) call.getArgs().get(0)).getStringValue();
            PrintfFormat parsed = PrintfFormat.parse(format, call.getLocation());
            List<Expression> args = call.getArgs().subList(1, call.getArgs().size());
            if (parsed.getConversionCount() != args.size()) {
                throw new GenException("printf format has " + parsed.getConversionCount()
                        + " conversion(s) but " + args.size() + " argument(s) were given", call.getLocation());
            }

            List<String> descriptors = new ArrayList<String>();
            List<String> items = new ArrayList<String>();
            List<String> text = new ArrayList<String>();
            renderer.setCallHoister(new ExpressionRenderer.CallHoister() {
                @Override
                public String hoist(String callText, CType type) {
                    String temp = temporary(type);
                    writer.line(temp + " = " + callText);
                    return temp;
                }
            });
            try {
                int next = 0;
                for (PrintfFormat.Segment segment : parsed.getSegments()) {
                    switch (segment.getKind()) {
                        case TEXT:
                            appendText(segment.getText(), text, call.getLocation());
                            break;
                        case NEWLINE:
                            flushText(text, descriptors, items);
                            descriptors.add("/");
                            break;
                        default: {
                            Expression arg = args.get(next++);
                            switch (segment.getConversion()) {
                                case STRING:
                                    if (!(arg instanceof Literal) || ((Literal) arg).getKind() != Literal.LiteralKind.STRING) {
                                        throw new GenException("%s is only translated with a string literal argument",
                                                arg.getLocation());
                                    }
                                    appendText(((Literal) arg).getStringValue(), text, arg.getLocation());
                                    break;
                                case REAL:
                                    throw new GenException("'" + segment.getText()
                                            + "' needs a floating-point argument, got an integer", arg.getLocation());
                                case UNSIGNED: {
                                    flushText(text, descriptors, items);
                                    Code value = renderer.render(arg);
                                    descriptors.add(value.type.isWide() ? "A" : "I0");
                                    items.add(renderer.unsigned(value));
                                    break;
                                }
                                default:
                                    flushText(text, descriptors, items);
                                    descriptors.add("I0");
                                    items.add(renderer.integer(arg).text);
                                    break;
                            }
                        }
                    }
                }
                flushText(text, descriptors, items);
            } finally {
                renderer.setCallHoister(null);
            }

            if (items.isEmpty()) {
                if (!parsed.isAdvancing() && descriptors.isEmpty()) {
                    LOG.fine("Skipping printf with an empty format at " + call.getLocation());
                    return;
                }
                descriptors.add("A");
                items.add("''");
            }
            StringBuilder line = new StringBuilder("write(*, '(").append(String.join(", ", descriptors)).append(")'");
            if (!parsed.isAdvancing()) {
                line.append(", advance='no'");
            }
            line.append(") ").append(String.join(", ", items));
            writer.line(line.toString());
        }

        /** 字面文本拆成字符常量，制表符用 achar(9) */
        private void appendText(String value, List<String> text, SourceLocation loc) {
            if (value.indexOf('\n') >= 0) {
                throw new GenException("Newlines inside a %s argument are not translated", loc);
            }
            StringBuilder piece = new StringBuilder();
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\t') {
                    if (piece.length() > 0) {
                        text.add(quote(piece.toString()));
                        piece.setLength(0);
                    }
                    text.add("achar(9)");
                } else {
                    piece.append(c);
                }
            }
            if (piece.length() > 0) {
                text.add(quote(piece.toString()));
            }
        }

        private void flushText(List<String> text, List<String> descriptors, List<String> items) {
            if (text.isEmpty()) {
                return;
            }
            descriptors.add("A");
            items.add(String.join(" // ", text));
            text.clear();
        }

        private String quote(String s) {
            return "'" + s.replace("'", "''") + "'";
        }

        private void emitRead(CallExpr call) {
            String format = ((Literal) call.getArgs().get(0)).getStringValue().replaceAll("\\s+", "");
            List<Expression> targets = call.getArgs().subList(1, call.getArgs().size());
            if (!SCANF_FORMAT.matcher(format).matches()) {
                throw new GenException("Unsupported scanf format \"" + format
                        + "\" (only integer conversions separated by whitespace)", call.getLocation());
            }
            List<String> conversions = new ArrayList<String>();
            Matcher m = SCANF_CONVERSION.matcher(format);
            while (m.find()) {
                conversions.add(m.group());
            }
            if (conversions.size() != targets.size()) {
                throw new GenException("scanf format has " + conversions.size()
                        + " conversion(s) but " + targets.size() + " target(s) were given", call.getLocation());
            }
            List<String> items = new ArrayList<String>();
            for (int i = 0; i < targets.size(); i++) {
                Expression target = ((UnaryExpr) targets.get(i)).getOperand();
                Code code = renderer.render(target);
                boolean wideConversion = conversions.get(i).startsWith("%ll");
                if (wideConversion != code.type.isWide()) {
                    throw new GenException("'" + conversions.get(i) + "' does not match the type "
                            + code.type + " of its target", target.getLocation());
                }
                items.add(code.text);
            }
            writer.line("read(*, *, iostat=" + ioStatus() + ") " + String.join(", ", items));
        }

        // ============ 不会出现在提升后函数体中的节点 ============

        @Override
        public Void visitVarDecl(VarDecl node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitArrayDecl(ArrayDecl node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitProgram(Program node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitFunctionDecl(FunctionDecl node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitParameter(Parameter node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitConstantDecl(ConstantDecl node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitLiteral(Literal node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitIdentifier(Identifier node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitCallExpr(CallExpr node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitIndexExpr(IndexExpr node, Void ctx) {
            throw notStatement(node);
        }

        @Override
        public Void visitArrayLiteral(ArrayLiteral node, Void ctx) {
            throw notStatement(node);
        }

        private IllegalStateException notStatement(Object node) {
            return new IllegalStateException("Unexpected " + node.getClass().getSimpleName()
                    + " in the hoisted body of '" + fn.getName() + "'");
        }
    }

    /**
     * 可翻译的 scanf 条件：{@code scanf(...) == N} 或 {@code != N}，单独出现或作为 && 链最左侧的操作数。
     * N 必须等于格式中的转换个数，此时 iostat 为 0 与"全部转换成功"等价。
     */
    static final class ScanfCondition {
        final CallExpr call;
        final boolean success;
        final List<Expression> rest;

        private ScanfCondition(CallExpr call, boolean success, List<Expression> rest) {
            this.call = call;
            this.success = success;
            this.rest = rest;
        }

        /**
         * @return 条件中没有 scanf 时为 null
         * @throws GenException scanf 出现在其它位置
         */
        static ScanfCondition find(Expression cond) {
            Deque<Expression> rest = new ArrayDeque<Expression>();
            Expression leaf = cond;
            while (leaf instanceof BinaryExpr && ((BinaryExpr) leaf).getOperator() == BinaryExpr.BinaryOp.AND) {
                rest.push(((BinaryExpr) leaf).getRight());
                leaf = ((BinaryExpr) leaf).getLeft();
            }
            ScanfCondition found = null;
            if (leaf instanceof BinaryExpr) {
                BinaryExpr cmp = (BinaryExpr) leaf;
                boolean eq = cmp.getOperator() == BinaryExpr.BinaryOp.EQ;
                if ((eq || cmp.getOperator() == BinaryExpr.BinaryOp.NE) && isScanf(cmp.getLeft())
                        && cmp.getRight() instanceof Literal
                        && ((Literal) cmp.getRight()).getKind() == Literal.LiteralKind.INT) {
                    CallExpr call = (CallExpr) cmp.getLeft();
                    checkCount(call, ((Literal) cmp.getRight()).getIntValue(), cmp.getLocation());
                    found = new ScanfCondition(call, eq, new ArrayList<Expression>(rest));
                }
            }
            if (found == null) {
                if (containsScanf(cond)) {
                    throw new GenException("scanf in a condition is only translated as 'scanf(...) == N'"
                            + " or 'scanf(...) != N', alone or as the leftmost operand of &&", cond.getLocation());
                }
                return null;
            }
            for (Expression operand : found.rest) {
                if (containsScanf(operand)) {
                    throw new GenException("Only one scanf per condition is translated", operand.getLocation());
                }
            }
            return found;
        }

        /**
         * 比较值必须等于转换个数；格式本身不合法时留给 read 的生成报错
         */
        private static void checkCount(CallExpr call, long expected, SourceLocation loc) {
            String format = ((Literal) call.getArgs().get(0)).getStringValue().replaceAll("\\s+", "");
            if (!SCANF_FORMAT.matcher(format).matches()) {
                return;
            }
            int conversions = 0;
            Matcher m = SCANF_CONVERSION.matcher(format);
            while (m.find()) {
                conversions++;
            }
            if (expected != conversions) {
                throw new GenException("scanf result compared with " + expected + " but the format has "
                        + conversions + " conversion(s); only a full read can be checked", loc);
            }
        }

        private static boolean isScanf(Expression expr) {
            return expr instanceof CallExpr && ((CallExpr) expr).isScanf();
        }

        private static boolean containsScanf(Expression expr) {
            if (isScanf(expr)) {
                return true;
            }
            if (expr instanceof CallExpr) {
                for (Expression arg : ((CallExpr) expr).getArgs()) {
                    if (containsScanf(arg)) return true;
                }
                return false;
            }
            if (expr instanceof BinaryExpr) {
                return containsScanf(((BinaryExpr) expr).getLeft()) || containsScanf(((BinaryExpr) expr).getRight());
            }
            if (expr instanceof UnaryExpr) {
                return containsScanf(((UnaryExpr) expr).getOperand());
            }
            if (expr instanceof IndexExpr) {
                return containsScanf(((IndexExpr) expr).getIndex());
            }
            return false;
        }
    }
}
