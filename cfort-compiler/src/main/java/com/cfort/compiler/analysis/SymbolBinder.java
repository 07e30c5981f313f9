package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstVisitor;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.decl.*;
import com.cfort.compiler.ast.expr.*;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
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

/**
 * 符号绑定：为每个函数建立扁平作用域，解析标识符与调用，做语法层面的类型检查，
 * 并为有返回值的函数选定结果变量名。
 *
 * <p>表达式访问返回表达式的 {@link CType}；字符串字面量返回 null。</p>
 */
public final class SymbolBinder implements AstVisitor<CType, SymbolBinder.Use> {
    private static final Logger LOG = Logger.getLogger(SymbolBinder.class.getName());

    /**
     * 表达式出现的位置
     */
    enum Use {
        VALUE,          // 普通取值
        STATEMENT,      // 表达式语句
        PRINTF_ARG,     // printf 的格式之后的实参
        SCANF_ARG       // scanf 的格式之后的实参
    }

    private final Map<String, ConstantDecl> constants = new LinkedHashMap<String, ConstantDecl>();
    private final Map<String, FunctionDecl> definitions = new LinkedHashMap<String, FunctionDecl>();
    private final Map<String, FunctionDecl> prototypes = new HashMap<String, FunctionDecl>();

    // 当前函数的状态
    private FunctionDecl currentFunction;
    private FunctionScope currentScope;
    private final Deque<Map<String, Symbol>> blockScopes = new ArrayDeque<Map<String, Symbol>>();
    private final Deque<Integer> blockIds = new ArrayDeque<Integer>();
    private int nextBlockId;

    /**
     * 绑定入口
     */
    public TranslationUnit bind(Program program) {
        registerGlobals(program);

        FunctionDecl mainDecl = definitions.get("main");
        if (mainDecl == null) {
            throw new BindException(BindException.Kind.UNRESOLVED_IDENTIFIER,
                    "No definition of function 'main'", program.getLocation());
        }
        checkMainSignature(mainDecl);

        Map<FunctionDecl, FunctionScope> scopes = new LinkedHashMap<FunctionDecl, FunctionScope>();
        for (FunctionDecl fn : definitions.values()) {
            scopes.put(fn, bindFunction(fn));
        }

        Set<String> usedNames = collectProgramNames(scopes.values());
        List<FunctionUnit> functions = new ArrayList<FunctionUnit>();
        FunctionUnit main = null;
        for (Map.Entry<FunctionDecl, FunctionScope> entry : scopes.entrySet()) {
            FunctionDecl fn = entry.getKey();
            String resultName = null;
            if (!fn.isMain() && !fn.getReturnType().isVoid()) {
                resultName = chooseResultName(fn.getName(), usedNames);
            }
            FunctionUnit unit = new FunctionUnit(fn, entry.getValue(), resultName);
            if (fn.isMain()) {
                main = unit;
            } else {
                functions.add(unit);
            }
        }

        LOG.log(Level.FINE, "Bound {0} function(s) in {1}",
                new Object[]{scopes.size(), program.getFileName()});
        return new TranslationUnit(program.getFileName(), program.getIncludes(),
                new ArrayList<ConstantDecl>(constants.values()), functions, main);
    }

    // ============ 全局符号 ============

    private void registerGlobals(Program program) {
        // Fortran 不区分大小写，全局名字按小写判重
        Map<String, AstNode> globalNames = new HashMap<String, AstNode>();

        for (ConstantDecl c : program.getConstants()) {
            if (constants.containsKey(c.getName())) {
                throw duplicate("Duplicate #define '" + c.getName() + "'", c.getLocation());
            }
            checkGlobalName(globalNames, c.getName(), c);
            constants.put(c.getName(), c);
        }

        for (FunctionDecl fn : program.getFunctions()) {
            if (fn.isPrototype()) {
                FunctionDecl earlier = prototypes.get(fn.getName());
                if (earlier != null) {
                    checkSignatureMatch(earlier, fn);
                } else {
                    prototypes.put(fn.getName(), fn);
                }
                FunctionDecl def = definitions.get(fn.getName());
                if (def != null) {
                    checkSignatureMatch(fn, def);
                } else if (earlier == null) {
                    checkGlobalName(globalNames, fn.getName(), fn);
                }
                continue;
            }
            if (definitions.containsKey(fn.getName())) {
                throw duplicate("Duplicate definition of function '" + fn.getName() + "'", fn.getLocation());
            }
            FunctionDecl proto = prototypes.get(fn.getName());
            if (proto != null) {
                checkSignatureMatch(proto, fn);
            } else {
                checkGlobalName(globalNames, fn.getName(), fn);
            }
            definitions.put(fn.getName(), fn);
        }

        for (FunctionDecl proto : prototypes.values()) {
            if (!definitions.containsKey(proto.getName())) {
                LOG.log(Level.FINE, "Prototype without definition: {0}", proto.getName());
            }
        }
    }

    private void checkGlobalName(Map<String, AstNode> globalNames, String name, AstNode node) {
        String key = name.toLowerCase(Locale.ROOT);
        AstNode earlier = globalNames.get(key);
        if (earlier != null) {
            throw duplicate("Global name '" + name + "' clashes with an earlier declaration at "
                    + earlier.getLocation() + " (names are case-insensitive in Fortran)", node.getLocation());
        }
        globalNames.put(key, node);
    }

    private void checkSignatureMatch(FunctionDecl first, FunctionDecl second) {
        boolean matches = first.getReturnType().equals(second.getReturnType())
                && first.getParams().size() == second.getParams().size();
        for (int i = 0; matches && i < first.getParams().size(); i++) {
            matches = first.getParams().get(i).getType().equals(second.getParams().get(i).getType());
        }
        if (!matches) {
            throw mismatch("Declaration of '" + second.getName() + "' does not match its prototype at "
                    + first.getLocation(), second.getLocation());
        }
    }

    private void checkMainSignature(FunctionDecl mainDecl) {
        if (!mainDecl.getReturnType().equals(CType.INT32)) {
            throw mismatch("'main' must return int", mainDecl.getLocation());
        }
        if (!mainDecl.getParams().isEmpty()) {
            throw mismatch("'main' must not take parameters", mainDecl.getLocation());
        }
    }

    // ============ 函数 ============

    private FunctionScope bindFunction(FunctionDecl fn) {
        currentFunction = fn;
        currentScope = new FunctionScope(fn.getName());
        blockScopes.clear();
        blockIds.clear();
        nextBlockId = 0;

        // 参数与函数体顶层块共享块 0
        enterBlock();
        for (Parameter p : fn.getParams()) {
            p.accept(this, null);
        }
        for (Statement stmt : fn.getBody().getStatements()) {
            stmt.accept(this, null);
        }
        exitBlock();

        FunctionScope scope = currentScope;
        currentFunction = null;
        currentScope = null;
        return scope;
    }

    private void enterBlock() {
        blockScopes.push(new HashMap<String, Symbol>());
        blockIds.push(nextBlockId++);
    }

    private void exitBlock() {
        blockScopes.pop();
        blockIds.pop();
    }

    private void declare(String name, SymbolKind kind, CType type, AstNode node) {
        Map<String, Symbol> block = blockScopes.peek();
        Symbol existing = block.get(name);
        if (existing != null) {
            throw duplicate("Duplicate declaration of '" + name + "' (previous declaration at "
                    + existing.getLocation() + ")", node.getLocation());
        }
        if (constants.containsKey(name)) {
            throw duplicate("'" + name + "' is already a #define constant", node.getLocation());
        }
        Symbol symbol = new Symbol(name, kind, type, currentFunction.getName(), blockIds.peek(),
                node.getLocation(), node);
        block.put(name, symbol);
        currentScope.define(symbol);
    }

    /**
     * 先按 C 块作用域查找，不可见时退回函数内的扁平查找（可见性由声明提升阶段检查）
     */
    private Symbol resolveLocal(String name) {
        for (Map<String, Symbol> block : blockScopes) {
            Symbol s = block.get(name);
            if (s != null) return s;
        }
        return currentScope.lookup(name);
    }

    private FunctionDecl resolveFunction(String name, SourceLocation location) {
        FunctionDecl fn = definitions.get(name);
        if (fn != null) return fn;
        if (prototypes.containsKey(name)) {
            throw unresolved("Function '" + name + "' is declared but never defined", location);
        }
        throw unresolved("Call to undeclared function '" + name + "'", location);
    }

    // ============ 结果变量命名 ============

    private Set<String> collectProgramNames(Iterable<FunctionScope> scopes) {
        Set<String> names = new HashSet<String>();
        for (String c : constants.keySet()) {
            names.add(c.toLowerCase(Locale.ROOT));
        }
        for (String f : definitions.keySet()) {
            names.add(f.toLowerCase(Locale.ROOT));
        }
        for (FunctionScope scope : scopes) {
            for (Symbol s : scope.getSymbols()) {
                names.add(s.getName().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static String chooseResultName(String functionName, Set<String> usedNames) {
        String base = functionName + "_result";
        String candidate = base;
        int suffix = 2;
        while (usedNames.contains(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "_" + suffix++;
        }
        usedNames.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }

    // ============ 声明 ============

    @Override
    public CType visitProgram(Program node, Use ctx) {
        throw new UnsupportedOperationException("Use bind(Program)");
    }

    @Override
    public CType visitFunctionDecl(FunctionDecl node, Use ctx) {
        throw new UnsupportedOperationException("Functions are bound through bind(Program)");
    }

    @Override
    public CType visitParameter(Parameter node, Use ctx) {
        declare(node.getName(), SymbolKind.PARAMETER, node.getType(), node);
        return null;
    }

    @Override
    public CType visitConstantDecl(ConstantDecl node, Use ctx) {
        return node.isWide() ? CType.UINT64 : CType.INT32;
    }

    // ============ 语句 ============

    @Override
    public CType visitBlock(Block node, Use ctx) {
        enterBlock();
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, null);
        }
        exitBlock();
        return null;
    }

    @Override
    public CType visitVarDecl(VarDecl node, Use ctx) {
        if (node.hasInitializer()) {
            requireScalar(node.getInitializer(), "initializer of '" + node.getName() + "'");
        }
        declare(node.getName(), SymbolKind.LOCAL, node.getType(), node);
        return null;
    }

    @Override
    public CType visitArrayDecl(ArrayDecl node, Use ctx) {
        if (node.hasInitializer()) {
            for (Expression value : node.getInitializers()) {
                requireScalar(value, "initializer of array '" + node.getName() + "'");
            }
        }
        declare(node.getName(), SymbolKind.LOCAL, node.getType(), node);
        return null;
    }

    @Override
    public CType visitAssignStmt(AssignStmt node, Use ctx) {
        checkAssignTarget(node.getTarget());
        requireScalar(node.getValue(), "assigned value");
        return null;
    }

    @Override
    public CType visitCompoundAssignStmt(CompoundAssignStmt node, Use ctx) {
        checkAssignTarget(node.getTarget());
        requireScalar(node.getValue(), "operand of '" + node.getOperator().toSourceString() + "='");
        return null;
    }

    private void checkAssignTarget(Expression target) {
        if (target instanceof Identifier) {
            String name = ((Identifier) target).getName();
            if (resolveLocal(name) == null && constants.containsKey(name)) {
                throw mismatch("Cannot assign to #define constant '" + name + "'", target.getLocation());
            }
            if (resolveLocal(name) == null && definitions.containsKey(name)) {
                throw mismatch("Cannot assign to function '" + name + "'", target.getLocation());
            }
            Symbol symbol = resolveIdentifier((Identifier) target);
            if (symbol.isArray()) {
                throw mismatch("Cannot assign to whole array '" + name + "'", target.getLocation());
            }
        } else {
            target.accept(this, Use.VALUE);
        }
    }

    @Override
    public CType visitIfStmt(IfStmt node, Use ctx) {
        requireScalar(node.getCondition(), "if condition");
        node.getThenBlock().accept(this, null);
        if (node.hasElse()) {
            node.getElseBlock().accept(this, null);
        }
        return null;
    }

    @Override
    public CType visitForStmt(ForStmt node, Use ctx) {
        // for-init 的声明作用域覆盖整个循环
        enterBlock();
        if (node.getInit() != null) {
            node.getInit().accept(this, null);
        }
        if (node.getCondition() != null) {
            requireScalar(node.getCondition(), "for condition");
        }
        if (node.getUpdate() != null) {
            node.getUpdate().accept(this, null);
        }
        node.getBody().accept(this, null);
        exitBlock();
        return null;
    }

    @Override
    public CType visitWhileStmt(WhileStmt node, Use ctx) {
        requireScalar(node.getCondition(), "while condition");
        node.getBody().accept(this, null);
        return null;
    }

    @Override
    public CType visitReturnStmt(ReturnStmt node, Use ctx) {
        boolean isVoid = currentFunction.getReturnType().isVoid();
        if (isVoid && node.hasValue()) {
            throw mismatch("Void function '" + currentFunction.getName() + "' cannot return a value",
                    node.getLocation());
        }
        if (!isVoid && !node.hasValue()) {
            throw mismatch("Function '" + currentFunction.getName() + "' must return a value",
                    node.getLocation());
        }
        if (node.hasValue()) {
            requireScalar(node.getValue(), "return value");
        }
        return null;
    }

    @Override
    public CType visitExpressionStmt(ExpressionStmt node, Use ctx) {
        node.getExpression().accept(this, Use.STATEMENT);
        return null;
    }

    // ============ 表达式 ============

    private CType requireScalar(Expression expr, String what) {
        CType type = expr.accept(this, Use.VALUE);
        if (type == null || !type.isScalar()) {
            throw mismatch("Expected an integer value for " + what
                    + (type != null ? ", found " + type : ""), expr.getLocation());
        }
        return type;
    }

    @Override
    public CType visitBinaryExpr(BinaryExpr node, Use ctx) {
        String what = "operand of '" + node.getOperator().toSourceString() + "'";
        CType left = requireScalar(node.getLeft(), what);
        CType right = requireScalar(node.getRight(), what);
        if (node.getOperator().yieldsLogical()) {
            return CType.INT32;
        }
        return left.isWide() || right.isWide() ? CType.UINT64 : CType.INT32;
    }

    @Override
    public CType visitUnaryExpr(UnaryExpr node, Use ctx) {
        switch (node.getOperator()) {
            case ADDRESS_OF: {
                if (ctx != Use.SCANF_ARG) {
                    throw mismatch("'&' is only supported on scanf arguments", node.getLocation());
                }
                Expression operand = node.getOperand();
                if (!(operand instanceof Identifier) && !(operand instanceof IndexExpr)) {
                    throw mismatch("'&' requires a variable or array element", node.getLocation());
                }
                if (operand instanceof Identifier && resolveLocal(((Identifier) operand).getName()) == null) {
                    throw mismatch("scanf target must be a local variable", operand.getLocation());
                }
                return requireScalar(operand, "scanf target");
            }
            case NOT:
                requireScalar(node.getOperand(), "operand of '!'");
                return CType.INT32;
            default:
                return requireScalar(node.getOperand(), "operand of unary '-'");
        }
    }

    @Override
    public CType visitLiteral(Literal node, Use ctx) {
        switch (node.getKind()) {
            case STRING:
                if (ctx != Use.PRINTF_ARG) {
                    throw mismatch("String literals are only supported as printf/scanf arguments",
                            node.getLocation());
                }
                return null;
            case INT:
                return node.isWide() ? CType.UINT64 : CType.INT32;
            default:
                return CType.INT32;
        }
    }

    @Override
    public CType visitIdentifier(Identifier node, Use ctx) {
        Symbol symbol = resolveIdentifier(node);
        if (symbol.isArray()) {
            throw mismatch("Array '" + node.getName() + "' used as a scalar", node.getLocation());
        }
        return symbol.getType();
    }

    private Symbol resolveIdentifier(Identifier node) {
        String name = node.getName();
        Symbol local = resolveLocal(name);
        if (local != null) return local;
        ConstantDecl constant = constants.get(name);
        if (constant != null) {
            return new Symbol(name, SymbolKind.CONSTANT, constant.accept(this, Use.VALUE), null, -1,
                    constant.getLocation(), constant);
        }
        if (definitions.containsKey(name) || prototypes.containsKey(name)) {
            throw mismatch("Function '" + name + "' used as a value", node.getLocation());
        }
        throw unresolved("Undeclared identifier '" + name + "'", node.getLocation());
    }

    @Override
    public CType visitCallExpr(CallExpr node, Use ctx) {
        if (node.isPrintf() || node.isScanf()) {
            return bindIoCall(node);
        }
        FunctionDecl fn = resolveFunction(node.getCallee(), node.getLocation());
        if (fn.isMain()) {
            throw mismatch("'main' cannot be called", node.getLocation());
        }
        if (fn.getParams().size() != node.getArgs().size()) {
            throw mismatch("Function '" + fn.getName() + "' expects " + fn.getParams().size()
                    + " argument(s), got " + node.getArgs().size(), node.getLocation());
        }
        for (Expression arg : node.getArgs()) {
            requireScalar(arg, "argument of '" + fn.getName() + "'");
        }
        if (fn.getReturnType().isVoid() && ctx != Use.STATEMENT) {
            throw mismatch("Void function '" + fn.getName() + "' used as a value", node.getLocation());
        }
        return fn.getReturnType().isVoid() ? CType.VOID : fn.getReturnType();
    }

    private CType bindIoCall(CallExpr node) {
        String callee = node.getCallee();
        if (node.getArgs().isEmpty()) {
            throw mismatch(callee + " requires a format string", node.getLocation());
        }
        Expression format = node.getArgs().get(0);
        if (!(format instanceof Literal) || ((Literal) format).getKind() != Literal.LiteralKind.STRING) {
            throw mismatch(callee + " format must be a string literal", format.getLocation());
        }
        Use argUse = node.isPrintf() ? Use.PRINTF_ARG : Use.SCANF_ARG;
        for (Expression arg : node.getArgs().subList(1, node.getArgs().size())) {
            if (node.isScanf() && !(arg instanceof UnaryExpr
                    && ((UnaryExpr) arg).getOperator() == UnaryExpr.UnaryOp.ADDRESS_OF)) {
                throw mismatch("scanf arguments must be addresses ('&var')", arg.getLocation());
            }
            arg.accept(this, argUse);
        }
        return CType.INT32;
    }

    @Override
    public CType visitIndexExpr(IndexExpr node, Use ctx) {
        String name = node.getArray().getName();
        Symbol symbol = resolveIdentifier(node.getArray());
        if (!symbol.isArray()) {
            throw mismatch("'" + name + "' is not an array", node.getLocation());
        }
        requireScalar(node.getIndex(), "array index");
        return symbol.getType().getElementType();
    }

    @Override
    public CType visitArrayLiteral(ArrayLiteral node, Use ctx) {
        for (Expression value : node.getValues()) {
            requireScalar(value, "array element");
        }
        return null;
    }

    // ============ 错误 ============

    private static BindException duplicate(String message, SourceLocation location) {
        return new BindException(BindException.Kind.DUPLICATE_DECLARATION, message, location);
    }

    private static BindException unresolved(String message, SourceLocation location) {
        return new BindException(BindException.Kind.UNRESOLVED_IDENTIFIER, message, location);
    }

    private static BindException mismatch(String message, SourceLocation location) {
        return new BindException(BindException.Kind.TYPE_MISMATCH, message, location);
    }
}
