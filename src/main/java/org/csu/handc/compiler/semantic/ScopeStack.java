package org.csu.handc.compiler.semantic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * 作用域栈。每层作用域是一组已声明的变量名；栈底是顶层作用域，每个循环体压入一层。
 * 查找从最内层向外进行，内层可以遮蔽外层的同名变量。
 */
public class ScopeStack {

    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    public ScopeStack() {
        scopes.push(new HashSet<>());
    }

    public void enterScope() {
        scopes.push(new HashSet<>());
    }

    public void exitScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot exit the top-level scope");
        }
        scopes.pop();
    }

    /**
     * 在当前（最内层）作用域中声明变量。
     */
    public void declare(String name) {
        scopes.peek().add(name);
    }

    public boolean isDeclared(String name) {
        // ArrayDeque 的迭代顺序即从栈顶到栈底
        Iterator<Set<String>> it = scopes.iterator();
        while (it.hasNext()) {
            if (it.next().contains(name)) {
                return true;
            }
        }
        return false;
    }

    public int depth() {
        return scopes.size();
    }
}
