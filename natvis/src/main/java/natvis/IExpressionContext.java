package natvis;

/**
 * A stack frame (or other scope) that expressions typed by the user are evaluated in.
 */
public interface IExpressionContext {
    /**
     * Never returns null; failures are reported through {@link IVariable#isError()}.
     */
    public IVariable evaluate(String expression);
}
