package natvis;

import java.util.function.Function;

/**
 * By convention Left is the error side and Right is the ok side.
 */
public class Either<L, R> {
    private enum Which { left, right };

    private final Which which;
    private final L left;
    private final R right;

    private Either(Which which, L L, R R) {
        this.which = which;
        this.left = which == Which.left ? L : null;
        this.right = which == Which.right ? R : null;
    }

    public static <L,R> Either<L,R> Left(L v) {
        return new Either<>(Which.left, v, null);
    }

    public static <L,R> Either<L,R> Right(R v) {
        return new Either<>(Which.right, null, v);
    }

    // Either a b -> (a -> c) -> (b -> c) -> c
    public <Result> Result collapse(Function<L, Result> l, Function<R, Result> r) {
        return which == Which.left
            ? l.apply(left)
            : r.apply(right);
    }
}
