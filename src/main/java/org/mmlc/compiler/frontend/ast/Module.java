package org.mmlc.compiler.frontend.ast;

import java.util.List;
import java.util.Optional;

/**
 * A compilation unit: the root of the AST.
 *
 * @param name       The module name.
 * @param visibility The module visibility.
 * @param members    The members in declaration order.
 * @param sourcePath The file the module was parsed from.
 * @param operators  The operators in scope, empty until the operator registry has run.
 */
public record Module(String name, Visibility visibility, List<Member> members, String sourcePath,
                     OperatorTable operators) {

    public Module {
        members = List.copyOf(members);
    }

    /**
     * Creates a module as the parser produces it, without operators.
     * @param name The module name.
     * @param members The members.
     * @param sourcePath The source file.
     */
    public Module(String name, List<Member> members, String sourcePath) {
        this(name, Visibility.PUBLIC, members, sourcePath, OperatorTable.empty());
    }

    /**
     * @param newMembers The replacement members.
     * @return A copy with the given members.
     */
    public Module withMembers(List<Member> newMembers) {
        return new Module(name, visibility, newMembers, sourcePath, operators);
    }

    /**
     * @param table The operator table.
     * @return A copy with the given operators.
     */
    public Module withOperators(OperatorTable table) {
        return new Module(name, visibility, members, sourcePath, table);
    }

    /**
     * @param declName A declaration name.
     * @return The first declaration with that name.
     */
    public Optional<Decl> findDecl(String declName) {
        return members.stream()
                .filter(m -> m instanceof Decl d && d.name().equals(declName))
                .map(Decl.class::cast)
                .findFirst();
    }
}
