package work.lcod.infra.types;

public interface Type {
    String display();
}
