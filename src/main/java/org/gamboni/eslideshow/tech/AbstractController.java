package org.gamboni.eslideshow.tech;

import spark.Response;
import spark.Service;

import java.io.IOException;

/** A "controller" exposes back-end functionality to the front end as small HTTP services returning JSON. */
public abstract class AbstractController {
    protected final Service http;
    public final Mapping mapping;

    protected AbstractController(Service http, Mapping mapping) {
        this.http = http;
        this.mapping = mapping;
    }

    protected interface ServiceBody {
        Object execute() throws IOException;
    }

    protected interface ParamServiceBody {
        /** Execute the service with the given front-end-provided param value. */
        Object execute(String param) throws IOException;
    }

    protected void service(String name, ServiceBody serviceBody) {
        http.post("/" + name, (req, res) -> json(res, serviceBody.execute()));
    }

    protected void service(String name, ParamServiceBody serviceBody) {
        http.post("/" + name, (req, res) -> json(res, serviceBody.execute(req.body().trim())));
    }

    protected void getService(String name, ServiceBody serviceBody) {
        http.get("/" + name, (req, res) -> json(res, serviceBody.execute()));
    }

    /** Like {@link #getService} but serving plain text. */
    protected void getText(String name, ServiceBody serviceBody) {
        http.get("/" + name, (req, res) -> {
            res.type("text/plain;charset=utf-8");
            return serviceBody.execute();
        });
    }

    private String json(Response res, Object result) {
        res.type("application/json");
        return mapping.writeValueAsString(result);
    }
}
