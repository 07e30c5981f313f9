package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.LocalDecl;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.AstNode;
import com.cfort.compiler.ast.AstTransformer;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.SourceLocation;
import com.cfort.compiler.ast.decl.ConstantDecl;
import com.cfort.compiler.ast.decl.Parameter;
import com.cfort.compiler.ast.expr.ArrayLiteral;
import com.cfort.compiler.ast.expr.Expression;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 声明提升：把函数内任意嵌套位置的声明收集到扁平的声明列表中，
 * 声明语句改写为初始化赋值（无初始值的声明直接消失）。
 *
 * <p>名字冲突时第一次出现的声明保留原名，之后的声明依次加 {@code _2}、{@code _3} 后缀，
 * 跳过程序中出现过的任何名字；比较不区分大小写。函数名、结果变量名、常量名、内建函数名
 * 以及模块名和主程序名同样视为冲突。</p>
 */
public class DeclarationHoister implements UnitPass {
    private static final Logger LOG = Logger.getLogger(DeclarationHoister.class.getName());

    private final Collection<String> extraReserved;

    public DeclarationHoister(Collection<String> extraReserved) {
        this.extraReserved = extraReserved;
    }

    public DeclarationHoister() {
        this(new ArrayList<String>());
    }

    @Override
    public String getName() {
        return "DeclarationHoister";
    }

    @Override
    public TranslationUnit run(TranslationUnit unit) {
        Set<String> reserved = ReservedNames.forUnit(unit, extraReserved);
        Set<String> used = ReservedNames.usedInUnit(unit);
        Set<String> constants = new HashSet<String>();
        for (ConstantDecl c : unit.getConstants()) {
            constants.add(c.getName());
        }

        List<FunctionUnit> result = new ArrayList<>();
        for (FunctionUnit fn : unit.getAllFunctions()) {
            result.add(new FunctionHoister(fn, reserved, used, constants).hoist());
        }
        return unit.withFunctions(result);
    }

    /**
     * 单个函数的提升状态；重命名计数只在函数内有效
     */
    private static final class FunctionHoister extends AstTransformer {
        final FunctionUnit fn;
        final Set<String> reserved;
        final Set<String> used;
        final Set<String> constants;

        // 已分配的 Fortran 名字（小写）
        final Set<String> claimed = new HashSet<String>();
        final List<LocalDecl> declarations = new ArrayList<LocalDecl>();
        // C 块作用域：源码名 → 声明
        final Deque<Map<String, Declared>> scopes = new ArrayDeque<Map<String, Declared>>();
        // 同一源码名的全部声明，用于判断不相交块的类型冲突
        final Map<String, List<Declared>> bySourceName = new HashMap<String, List<Declared>>();

        FunctionHoister(FunctionUnit fn, Set<String> reserved, Set<String> used, Set<String> constants) {
            this.fn = fn;
            this.reserved = reserved;
            this.used = used;
            this.constants = constants;
        }

        FunctionUnit hoist() {
            Map<String, Declared> outer = new HashMap<String, Declared>();
            scopes.push(outer);

            if (fn.isHoisted()) {
                // 再次运行：已提升的名字原样登记，函数体中不再有声明
                for (LocalDecl decl : fn.getDeclarations()) {
                    Declared d = new Declared(decl.getName(), decl.getType(), outer);
                    outer.put(decl.getName(), d);
                    claimed.add(ReservedNames.key(decl.getName()));
                    declarations.add(decl);
                }
            } else {
                for (Parameter p : fn.getDeclaration().getParams()) {
                    declare(p.getName(), p.getType(), LocalDecl.Kind.PARAMETER, p.getLocation());
                }
            }

            Block body = transformBlock(fn.getBody());
            scopes.pop();

            if (fn.isHoisted() && body == fn.getBody()) {
                return fn;
            }
            return fn.withHoisted(body, declarations);
        }

        private String declare(String sourceName, CType type, LocalDecl.Kind kind, SourceLocation location) {
            Map<String, Declared> scope = scopes.peek();
            List<Declared> same = bySourceName.get(sourceName);
            if (same == null) {
                same = new ArrayList<Declared>();
                bySourceName.put(sourceName, same);
            }
            for (Declared earlier : same) {
                if (!isOpen(earlier.scope) && !earlier.type.equals(type)) {
                    throw new HoistException(HoistException.Kind.DUPLICATE_INCOMPATIBLE_TYPE,
                            "'" + sourceName + "' is declared as " + earlier.type + " and as " + type
                                    + " in disjoint blocks of '" + fn.getName() + "'", location);
                }
            }

            String name = allocate(sourceName);
            if (!name.equals(sourceName) && LOG.isLoggable(Level.FINE)) {
                LOG.fine("Renaming '" + sourceName + "' to '" + name + "' in '" + fn.getName() + "' at " + location);
            }
            Declared declared = new Declared(name, type, scope);
            scope.put(sourceName, declared);
            same.add(declared);
            declarations.add(new LocalDecl(name, sourceName, type, kind, location));
            return name;
        }

        /** 作用域是否仍在栈上（按引用比较） */
        private boolean isOpen(Map<String, Declared> scope) {
            for (Map<String, Declared> open : scopes) {
                if (open == scope) return true;
            }
            return false;
        }

        private String allocate(String sourceName) {
            String key = ReservedNames.key(sourceName);
            if (!claimed.contains(key) && !reserved.contains(key)) {
                claimed.add(key);
                return sourceName;
            }
            int suffix = 2;
            String candidate;
            do {
                candidate = sourceName + "_" + suffix++;
                key = ReservedNames.key(candidate);
            } while (claimed.contains(key) || reserved.contains(key) || used.contains(key));
            claimed.add(key);
            return candidate;
        }

        // ============ 作用域 ============

        @Override
        public AstNode visitBlock(Block node, Void ctx) {
            scopes.push(new HashMap<String, Declared>());
            try {
                return super.visitBlock(node, ctx);
            } finally {
                scopes.pop();
            }
        }

        @Override
        public AstNode visitForStmt(ForStmt node, Void ctx) {
            scopes.push(new HashMap<String, Declared>());
            try {
                return super.visitForStmt(node, ctx);
            } finally {
                scopes.pop();
            }
        }

        // ============ 声明 → 赋值 ============

        @Override
        public AstNode visitVarDecl(VarDecl node, Void ctx) {
            // 初始值在声明生效之前求值
            Expression init = transformExpr(node.getInitializer());
            String name = declare(node.getName(), node.getType(), LocalDecl.Kind.LOCAL, node.getLocation());
            if (init == null) {
                return null;
            }
            return new AssignStmt(node.getLocation(), new Identifier(node.getLocation(), name), init);
        }

        @Override
        public AstNode visitArrayDecl(ArrayDecl node, Void ctx) {
            List<Expression> inits = transformExprs(node.getInitializers());
            String name = declare(node.getName(), node.getType(), LocalDecl.Kind.LOCAL, node.getLocation());
            if (inits == null) {
                return null;
            }
            List<Expression> values = new ArrayList<Expression>(inits);
            while (values.size() < node.getSize()) {
                values.add(Literal.ofInt(node.getLocation(), 0));
            }
            return new AssignStmt(node.getLocation(), new Identifier(node.getLocation(), name),
                    new ArrayLiteral(node.getLocation(), values));
        }

        // ============ 引用 ============

        @Override
        public AstNode visitIdentifier(Identifier node, Void ctx) {
            String sourceName = node.getName();
            for (Map<String, Declared> scope : scopes) {
                Declared d = scope.get(sourceName);
                if (d != null) {
                    return d.name.equals(sourceName) ? node : new Identifier(node.getLocation(), d.name);
                }
            }
            if (constants.contains(sourceName) || sourceName.equals(fn.getResultName())) {
                return node;
            }
            throw new HoistException(HoistException.Kind.REFERENCE_OUT_OF_SCOPE,
                    "'" + sourceName + "' is not visible here", node.getLocation());
        }
    }

    private static final class Declared {
        final String name;
        final CType type;
        final Map<String, Declared> scope;

        Declared(String name, CType type, Map<String, Declared> scope) {
            this.name = name;
            this.type = type;
            this.scope = scope;
        }
    }
}
