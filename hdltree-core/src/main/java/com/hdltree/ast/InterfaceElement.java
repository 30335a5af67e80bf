package com.hdltree.ast;

public sealed interface InterfaceElement extends Node permits
    InterfaceObject,
    InterfaceType,
    InterfaceSubprogram,
    InterfacePackage {
}
