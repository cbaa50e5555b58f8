package domain.format;

/**
 * MyBatis SQL 본문을 파싱한 CST(Concrete Syntax Tree) 노드.
 *
 * <p>Closed set: {@link RootNode}, {@link TagNode}, {@link SqlTextNode}, {@link ParamNode}.
 * {@code start}/{@code end} are character offsets into the parsed input (end exclusive).</p>
 */
public sealed interface CstNode permits RootNode, TagNode, SqlTextNode, ParamNode {

    int getStart();

    int getEnd();
}
