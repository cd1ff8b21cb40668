package api.interfaces;

/*
AutoCloseable so tests and the shutdown hook can stop the listener
 */
public interface IHttpServer extends AutoCloseable {
    void start(String host, int port) throws Exception;

    /** Bound port; differs from the requested one when started on port 0. */
    int port();

    @Override void close() throws Exception;
}
