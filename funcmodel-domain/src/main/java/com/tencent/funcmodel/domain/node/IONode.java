package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * IONode - 输入/输出边界容器
 *
 * @author funcmodel
 */
public class IONode extends Node {

    private final IOData ioData;

    private IONode(NodeAttributes attributes, IOData ioData) {
        super(attributes);
        this.ioData = ioData;
    }

    private IONode(IONode source, IOData ioData) {
        super(source);
        this.ioData = ioData;
    }

    public static Result<IONode> create(NodeAttributes attributes, IOData ioData) {
        if (ioData == null || ioData.getBoundaryType() == null) {
            return Result.fail("IO node requires a boundary type");
        }
        return Result.ok(new IONode(attributes, copyOf(ioData)));
    }

    @Override
    public IONode copy() {
        return new IONode(this, copyOf(ioData));
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.IO;
    }

    public IOData getIoData() {
        return copyOf(ioData);
    }

    public BoundaryType getBoundaryType() {
        return ioData.getBoundaryType();
    }

    public boolean isInput() {
        return ioData.getBoundaryType().acceptsInput();
    }

    public boolean isOutput() {
        return ioData.getBoundaryType().producesOutput();
    }

    private static IOData copyOf(IOData source) {
        return IOData.builder()
                .boundaryType(source.getBoundaryType())
                .dataType(source.getDataType())
                .schema(source.getSchema())
                .required(source.isRequired())
                .validationRules(source.getValidationRules())
                .defaultValue(source.getDefaultValue())
                .build();
    }
}
