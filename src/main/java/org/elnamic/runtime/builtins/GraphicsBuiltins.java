package org.elnamic.runtime.builtins;

import org.elnamic.api.SourceInfo;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.RealValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;
import org.elnamic.runtime.spi.IGraphicsSurface;

import java.util.List;

import static org.elnamic.runtime.builtins.BuiltinArguments.function;
import static org.elnamic.runtime.builtins.BuiltinArguments.number;

/**
 * Turtle commands forwarded to the configured {@link IGraphicsSurface}.
 */
final class GraphicsBuiltins {

    private GraphicsBuiltins() {
        // Utility class
    }

    static void registerAll(BuiltinRegistry registry) {
        command(registry, "forward", 1, (g, a) -> g.forward(a.number(0)));
        command(registry, "backward", 1, (g, a) -> g.backward(a.number(0)));
        command(registry, "right", 1, (g, a) -> g.right(a.number(0)));
        command(registry, "left", 1, (g, a) -> g.left(a.number(0)));
        command(registry, "goto", 2, (g, a) -> g.goTo(a.number(0), a.number(1)));
        command(registry, "setposition", 2, (g, a) -> g.goTo(a.number(0), a.number(1)));
        command(registry, "setx", 1, (g, a) -> g.setX(a.number(0)));
        command(registry, "sety", 1, (g, a) -> g.setY(a.number(0)));
        command(registry, "setheading", 1, (g, a) -> g.setHeading(a.number(0)));
        command(registry, "penup", 0, (g, a) -> g.penUp());
        command(registry, "pendown", 0, (g, a) -> g.penDown());
        command(registry, "color", 1, (g, a) -> g.color(a.string(0)));
        command(registry, "bgcolor", 1, (g, a) -> g.backgroundColor(a.string(0)));
        command(registry, "width", 1, (g, a) -> g.width(a.number(0)));
        command(registry, "speed", 1, (g, a) -> g.speed(a.number(0)));
        command(registry, "dot", 1, (g, a) -> g.dot(a.number(0)));
        command(registry, "clear", 0, (g, a) -> g.clear());
        command(registry, "reset", 0, (g, a) -> g.reset());
        command(registry, "done", 0, (g, a) -> g.done());
        command(registry, "exitonclick", 0, (g, a) -> g.exitOnClick());

        registry.register("circle", 1, 2, (args, ctx, at) -> {
            Double extent = args.size() == 2 ? number(args, 1, "circle", at) : null;
            ctx.services().graphics().circle(number(args, 0, "circle", at), extent);
            return UnitValue.INSTANCE;
        });

        registry.register("xcor", 0, (args, ctx, at) -> new RealValue(ctx.services().graphics().xcor()));
        registry.register("ycor", 0, (args, ctx, at) -> new RealValue(ctx.services().graphics().ycor()));
        registry.register("heading", 0, (args, ctx, at) -> new RealValue(ctx.services().graphics().heading()));

        pointerEvent(registry, "on_click", IGraphicsSurface::onClick);
        pointerEvent(registry, "on_release", IGraphicsSurface::onRelease);
        pointerEvent(registry, "on_drag", IGraphicsSurface::onDrag);
        registry.register("on_key", 1, (args, ctx, at) -> {
            FunctionValue handler = function(args, 0, "on_key", at);
            ctx.services().graphics().onKey(key -> ctx.callFunction(handler, List.of(new StringValue(key)), at));
            return UnitValue.INSTANCE;
        });
    }

    private static void command(BuiltinRegistry registry, String name, int arity, Command command) {
        registry.register(name, arity, (args, ctx, at) -> {
            command.apply(ctx.services().graphics(), new Args(name, args, at));
            return UnitValue.INSTANCE;
        });
    }

    private static void pointerEvent(BuiltinRegistry registry, String name, Registration registration) {
        registry.register(name, 1, (args, ctx, at) -> {
            FunctionValue handler = function(args, 0, name, at);
            registration.register(ctx.services().graphics(), pointerHandler(handler, ctx, at));
            return UnitValue.INSTANCE;
        });
    }

    private static IGraphicsSurface.PointerListener pointerHandler(FunctionValue handler, ExecutionContext ctx, SourceInfo at) {
        return (x, y) -> ctx.callFunction(handler, List.of(new RealValue(x), new RealValue(y)), at);
    }

    @FunctionalInterface
    private interface Command {
        void apply(IGraphicsSurface graphics, Args args);
    }

    @FunctionalInterface
    private interface Registration {
        void register(IGraphicsSurface graphics, IGraphicsSurface.PointerListener listener);
    }

    private record Args(String builtin, List<Value> values, SourceInfo at) {
        double number(int index) {
            return BuiltinArguments.number(values, index, builtin, at);
        }

        String string(int index) {
            return BuiltinArguments.string(values, index, builtin, at);
        }
    }
}
